package warden.adapter.in.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;

/**
 * DTO for a single access decision.
 *
 * @param principalId the requesting principal
 * @param action      the attempted action
 * @param resource    the target resource with its attributes
 * @param context     optional request metadata
 */
public record DecisionRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotNull(message = "action is required") PermissionAction action,
        @NotNull(message = "resource is required") @Valid Resource resource,
        PermissionContext context) {}
