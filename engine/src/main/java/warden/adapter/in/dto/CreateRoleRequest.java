package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;

import warden.core.model.authz.Permission;

/**
 * DTO for role creation requests.
 *
 * @param id          unique identifier for the role (required, e.g., "auditor")
 * @param name        human-readable name
 * @param description optional description of the role's purpose
 * @param permissions permissions granted or denied to holders of this role, in evaluation order
 */
public record CreateRoleRequest(
        @NotBlank(message = "id is required") String id,
        @NotBlank(message = "name is required") String name,
        String description,
        List<Permission> permissions) {}
