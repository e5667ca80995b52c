package warden.core.model.authz;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a concrete resource an authorization decision is made against.
 */
public enum ResourceType {
    DOCUMENT,
    FOLDER,
    USER,
    TEAM,
    PROJECT,
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResourceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + value));
    }

    /**
     * Display form used in audit details, e.g. {@code Document}.
     */
    public String displayName() {
        final var lower = value();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
