package warden.core.model.authz;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source an attribute-based condition reads its value from.
 */
public enum ConditionType {
    /** Attribute of the requesting principal. */
    USER_ATTRIBUTE,
    /** Attribute of the target resource. */
    RESOURCE_ATTRIBUTE,
    /** Value carried by the request context. */
    CONTEXTUAL,
    /** Current time, read from the engine clock. */
    TEMPORAL,
    /** Device, location or network facts about the caller. */
    ENVIRONMENTAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionType fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
