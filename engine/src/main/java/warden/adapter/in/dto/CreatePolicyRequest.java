package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.PermissionRule;
import warden.core.model.authz.PermissionScope;
import warden.core.model.authz.PolicyPriority;

/**
 * DTO for policy creation requests.
 *
 * @param name        human-readable name
 * @param description optional description
 * @param rules       rules in evaluation order
 * @param scope       policy scope (optional, defaults to global)
 * @param scopeTarget the resource id or attribute value the scope is bound to (optional)
 * @param priority    evaluation priority (optional, defaults to normal)
 */
public record CreatePolicyRequest(
        @NotBlank(message = "name is required") String name,
        String description,
        @NotNull(message = "rules are required") List<PermissionRule> rules,
        PermissionScope scope,
        String scopeTarget,
        PolicyPriority priority) {}
