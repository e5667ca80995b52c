package warden.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for role revocation requests.
 *
 * @param principalId principal losing the role
 * @param roleId      the role to revoke
 * @param reason      optional reason recorded on the audit trail
 */
public record RevokeRoleRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotBlank(message = "roleId is required") String roleId,
        String reason) {}
