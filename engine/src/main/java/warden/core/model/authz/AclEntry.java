package warden.core.model.authz;

/**
 * A single access control entry.
 */
public record AclEntry(String principalId, PrincipalType principalType, PermissionAction action, boolean granted) {

    public AclEntry {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("ACL entry principal ID cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("ACL entry action cannot be null");
        }
        if (principalType == null) {
            principalType = PrincipalType.USER;
        }
    }

    public boolean matches(String principal, PermissionAction requested) {
        return principalId.equals(principal) && action == requested;
    }
}
