package warden.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationType {
    EXCESSIVE_DENIED_ATTEMPTS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
