package warden.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
