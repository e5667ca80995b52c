package warden.core.model.authz;

import java.time.Instant;

/**
 * A permission granted to one principal directly, outside any role.
 * Direct grants take precedence over every other source.
 */
public record DirectGrant(String id, String principalId, Permission permission, String grantedBy, Instant grantedAt) {

    public DirectGrant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Grant ID cannot be null or blank");
        }
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be null or blank");
        }
        if (permission == null) {
            throw new IllegalArgumentException("Permission cannot be null");
        }
    }
}
