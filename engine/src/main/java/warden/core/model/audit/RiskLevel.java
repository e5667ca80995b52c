package warden.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
