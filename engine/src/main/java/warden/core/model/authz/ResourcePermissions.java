package warden.core.model.authz;

import java.time.Instant;
import java.util.List;

/**
 * The full set of resource-level grants for a single resource.
 *
 * @param resourceId        target resource
 * @param resourceType      type of the target resource
 * @param grants            grants in evaluation order
 * @param inheritFromParent whether the grants were inherited from a parent resource
 * @param setBy             actor who set the grants
 * @param setAt             time the grants were set
 */
public record ResourcePermissions(
        String resourceId,
        ResourceType resourceType,
        List<PermissionGrant> grants,
        boolean inheritFromParent,
        String setBy,
        Instant setAt) {

    public ResourcePermissions {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource ID cannot be null or blank");
        }
        if (resourceType == null) {
            throw new IllegalArgumentException("Resource type cannot be null");
        }
        grants = grants == null ? List.of() : List.copyOf(grants);
    }
}
