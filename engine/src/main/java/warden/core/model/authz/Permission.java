package warden.core.model.authz;

import java.util.List;

/**
 * An action on a resource type, granted or explicitly denied.
 *
 * @param action       the permitted or denied action
 * @param resourceType resource type the permission applies to
 * @param granted      whether a match grants ({@code true}) or denies access
 * @param conditions   conditions that must all hold for the permission to apply
 */
public record Permission(
        PermissionAction action,
        PermissionResourceType resourceType,
        boolean granted,
        List<PermissionCondition> conditions) {

    public Permission {
        if (action == null) {
            throw new IllegalArgumentException("Permission action cannot be null");
        }
        if (resourceType == null) {
            resourceType = PermissionResourceType.ANY;
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Permission allow(PermissionAction action, PermissionResourceType resourceType) {
        return new Permission(action, resourceType, true, List.of());
    }

    public static Permission deny(PermissionAction action, PermissionResourceType resourceType) {
        return new Permission(action, resourceType, false, List.of());
    }

    /**
     * Check whether this permission covers the requested action on the resource,
     * ignoring conditions.
     */
    public boolean covers(PermissionAction requested, Resource resource, String principalId) {
        return action == requested && resourceType.appliesTo(resource, principalId);
    }
}
