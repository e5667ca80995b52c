package warden.core.model.authz;

import java.util.List;
import java.util.Set;

/**
 * Declares which actions an ACL inherits from a parent resource.
 */
public record InheritanceRule(
        String parentResourceId, Set<PermissionAction> inheritedActions, List<PermissionCondition> conditions) {

    public InheritanceRule {
        if (parentResourceId == null || parentResourceId.isBlank()) {
            throw new IllegalArgumentException("Parent resource ID cannot be null or blank");
        }
        inheritedActions = inheritedActions == null ? Set.of() : Set.copyOf(inheritedActions);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
