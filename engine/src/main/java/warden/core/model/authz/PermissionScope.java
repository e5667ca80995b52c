package warden.core.model.authz;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Breadth at which a policy or role assignment applies.
 */
public enum PermissionScope {
    GLOBAL,
    ORGANIZATION,
    DEPARTMENT,
    TEAM,
    PROJECT,
    RESOURCE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PermissionScope fromValue(String value) {
        return Arrays.stream(values())
                .filter(scope -> scope.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission scope: " + value));
    }
}
