package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;

/**
 * DTO for a multi-action, multi-resource evaluation.
 *
 * @param principalId the requesting principal
 * @param actions     actions to evaluate
 * @param resources   resources every action must be granted on
 * @param conditions  supplemental conditions that must all hold (optional)
 * @param context     optional request metadata
 */
public record EvaluationRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotEmpty(message = "at least one action is required") List<PermissionAction> actions,
        @NotEmpty(message = "at least one resource is required") List<Resource> resources,
        List<PermissionCondition> conditions,
        PermissionContext context) {}
