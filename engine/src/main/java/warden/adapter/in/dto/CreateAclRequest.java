package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.AclEntry;
import warden.core.model.authz.InheritanceRule;
import warden.core.model.authz.ResourceType;

/**
 * DTO for access control list creation.
 *
 * @param resourceId       the protected resource
 * @param resourceType     type of the resource
 * @param entries          entries in evaluation order
 * @param inheritanceRules optional inheritance rules
 */
public record CreateAclRequest(
        @NotBlank(message = "resourceId is required") String resourceId,
        @NotNull(message = "resourceType is required") ResourceType resourceType,
        List<AclEntry> entries,
        List<InheritanceRule> inheritanceRules) {}
