package warden.adapter.in.dto;

import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.Permission;

/**
 * DTO for granting a permission directly to a principal.
 */
public record GrantDirectPermissionRequest(@NotNull(message = "permission is required") Permission permission) {}
