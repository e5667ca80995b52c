package warden.core.model.authz;

import java.time.Instant;
import java.util.List;

/**
 * Access control list attached to a resource.
 *
 * <p>A resource may carry several ACLs; they are consulted in creation order.
 */
public record AccessControlList(
        String id,
        String resourceId,
        ResourceType resourceType,
        List<AclEntry> entries,
        List<InheritanceRule> inheritanceRules,
        String createdBy,
        Instant createdAt,
        String modifiedBy,
        Instant modifiedAt) {

    public AccessControlList {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("ACL ID cannot be null or blank");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource ID cannot be null or blank");
        }
        if (resourceType == null) {
            throw new IllegalArgumentException("Resource type cannot be null");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
        inheritanceRules = inheritanceRules == null ? List.of() : List.copyOf(inheritanceRules);
    }

    public AccessControlList withEntries(List<AclEntry> newEntries, String by, Instant at) {
        return new AccessControlList(
                id, resourceId, resourceType, newEntries, inheritanceRules, createdBy, createdAt, by, at);
    }
}
