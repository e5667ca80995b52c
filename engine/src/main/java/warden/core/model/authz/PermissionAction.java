package warden.core.model.authz;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operations a principal may attempt against a resource.
 */
public enum PermissionAction {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    APPROVE,
    REJECT,
    SHARE,
    DOWNLOAD,
    UPLOAD,
    MANAGE,
    ADMIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PermissionAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(action -> action.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission action: " + value));
    }
}
