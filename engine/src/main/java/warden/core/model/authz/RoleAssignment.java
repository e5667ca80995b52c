package warden.core.model.authz;

import java.time.Instant;

/**
 * Binding of a role to a principal.
 *
 * <p>Assignments are never physically deleted. Revocation produces a copy with
 * {@code active=false} and the revocation metadata filled in. An assignment past
 * its expiration date is treated as inactive without being modified.
 *
 * @param id               unique identifier
 * @param principalId      principal holding the role
 * @param roleId           assigned role
 * @param scope            breadth the assignment was made at (informational)
 * @param assignedBy       actor who made the assignment
 * @param assignedAt       assignment time
 * @param expirationDate   optional expiry, null for no expiry
 * @param active           false once revoked
 * @param revokedAt        revocation time, null while active
 * @param revokedBy        actor who revoked, null while active
 * @param revocationReason optional reason supplied on revocation
 */
public record RoleAssignment(
        String id,
        String principalId,
        String roleId,
        PermissionScope scope,
        String assignedBy,
        Instant assignedAt,
        Instant expirationDate,
        boolean active,
        Instant revokedAt,
        String revokedBy,
        String revocationReason) {

    public RoleAssignment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Assignment ID cannot be null or blank");
        }
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be null or blank");
        }
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Role ID cannot be null or blank");
        }
        if (scope == null) {
            scope = PermissionScope.GLOBAL;
        }
    }

    /**
     * Create a fresh active assignment.
     */
    public static RoleAssignment create(
            String id,
            String principalId,
            String roleId,
            PermissionScope scope,
            String assignedBy,
            Instant assignedAt,
            Instant expirationDate) {
        return new RoleAssignment(
                id, principalId, roleId, scope, assignedBy, assignedAt, expirationDate, true, null, null, null);
    }

    /**
     * Check whether the assignment has passed its expiration date.
     *
     * @param now current time
     * @return true if an expiration date is set and {@code now} is after it
     */
    public boolean isExpired(Instant now) {
        return expirationDate != null && now.isAfter(expirationDate);
    }

    /**
     * Check whether the assignment currently confers its role.
     *
     * @param now current time
     * @return true if active and not expired
     */
    public boolean isEffective(Instant now) {
        return active && !isExpired(now);
    }

    /**
     * Create the revoked form of this assignment.
     */
    public RoleAssignment revoke(String by, String reason, Instant at) {
        return new RoleAssignment(
                id, principalId, roleId, scope, assignedBy, assignedAt, expirationDate, false, at, by, reason);
    }
}
