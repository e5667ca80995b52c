package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.PermissionGrant;
import warden.core.model.authz.ResourceType;

/**
 * DTO replacing the resource-level grants of a resource.
 *
 * @param resourceType      type of the resource
 * @param grants            the complete new grant list
 * @param inheritFromParent whether the grants were inherited
 */
public record SetResourcePermissionsRequest(
        @NotNull(message = "resourceType is required") ResourceType resourceType,
        List<PermissionGrant> grants,
        boolean inheritFromParent) {}
