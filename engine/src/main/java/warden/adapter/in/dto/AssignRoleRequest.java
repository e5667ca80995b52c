package warden.adapter.in.dto;

import java.time.Instant;

import jakarta.validation.constraints.NotBlank;

import warden.core.model.authz.PermissionScope;

/**
 * DTO for role assignment requests.
 *
 * @param principalId    principal receiving the role
 * @param roleId         an existing role
 * @param scope          assignment scope (optional, defaults to global)
 * @param expirationDate optional expiry
 */
public record AssignRoleRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotBlank(message = "roleId is required") String roleId,
        PermissionScope scope,
        Instant expirationDate) {}
