package warden.core.model.authz;

import java.util.List;

/**
 * A resource-level grant or denial for one principal.
 *
 * @param principalId   principal the grant targets
 * @param principalType kind of principal
 * @param action        covered action
 * @param granted       grant ({@code true}) or explicit denial
 * @param conditions    conditions that must all hold for the grant to apply
 */
public record PermissionGrant(
        String principalId,
        PrincipalType principalType,
        PermissionAction action,
        boolean granted,
        List<PermissionCondition> conditions) {

    public PermissionGrant {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Grant principal ID cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("Grant action cannot be null");
        }
        if (principalType == null) {
            principalType = PrincipalType.USER;
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static PermissionGrant of(String principalId, PermissionAction action, boolean granted) {
        return new PermissionGrant(principalId, PrincipalType.USER, action, granted, List.of());
    }
}
