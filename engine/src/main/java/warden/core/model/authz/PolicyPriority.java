package warden.core.model.authz;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy ordering weight. Higher levels are evaluated first.
 */
public enum PolicyPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    PolicyPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyPriority fromValue(String value) {
        return Arrays.stream(values())
                .filter(priority -> priority.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown policy priority: " + value));
    }
}
