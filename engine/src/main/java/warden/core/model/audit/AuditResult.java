package warden.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditResult {
    GRANTED,
    DENIED;

    public static AuditResult of(boolean granted) {
        return granted ? GRANTED : DENIED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditResult fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
