package warden.core.model.authz;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resource type a permission applies to.
 *
 * <p>{@link #ANY} is a wildcard. {@link #OWN_DOCUMENT} applies to documents
 * whose {@code owner} attribute equals the requesting principal.
 */
public enum PermissionResourceType {
    ANY(null),
    DOCUMENT(ResourceType.DOCUMENT),
    OWN_DOCUMENT(ResourceType.DOCUMENT),
    FOLDER(ResourceType.FOLDER),
    USER(ResourceType.USER),
    TEAM(ResourceType.TEAM),
    PROJECT(ResourceType.PROJECT),
    SYSTEM(ResourceType.SYSTEM);

    static final String OWNER_ATTRIBUTE = "owner";

    private final ResourceType target;

    PermissionResourceType(ResourceType target) {
        this.target = target;
    }

    /**
     * Check whether this permission type covers the given resource when
     * requested by the given principal.
     *
     * @param resource    the resource being accessed
     * @param principalId the requesting principal
     * @return true if the permission applies
     */
    public boolean appliesTo(Resource resource, String principalId) {
        if (this == ANY) {
            return true;
        }
        if (resource.type() != target) {
            return false;
        }
        if (this == OWN_DOCUMENT) {
            return resource.attribute(OWNER_ATTRIBUTE)
                    .map(owner -> owner.equals(principalId))
                    .orElse(false);
        }
        return true;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PermissionResourceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission resource type: " + value));
    }
}
