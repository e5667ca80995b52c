package warden.core.model.authz;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleEffect {
    ALLOW,
    DENY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleEffect fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
