package warden.adapter.in.dto;

import warden.core.model.authz.PermissionAction;

/**
 * DTO for the outcome of a single access decision.
 */
public record DecisionResponse(String principalId, PermissionAction action, String resourceId, boolean granted) {}
