package warden.core.model.authz;

import java.time.Instant;
import java.util.List;

/**
 * Per-principal snapshot of active role assignments and direct permissions.
 *
 * <p>Recomputed whenever the principal's assignments or direct grants change.
 * Expiry is checked at decision time, not when the snapshot is built.
 *
 * @param principalId       principal the snapshot belongs to
 * @param assignments       active assignments in assignment order
 * @param directPermissions direct permissions in grant order
 * @param computedAt        when the snapshot was computed
 */
public record EffectivePermissions(
        String principalId,
        List<RoleAssignment> assignments,
        List<Permission> directPermissions,
        Instant computedAt) {

    public EffectivePermissions {
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        directPermissions = directPermissions == null ? List.of() : List.copyOf(directPermissions);
    }

    public static EffectivePermissions empty(String principalId) {
        return new EffectivePermissions(principalId, List.of(), List.of(), null);
    }
}
