package warden.core.service.authz;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.Resource;
import warden.core.port.out.AttributeProvider;

/**
 * Decides whether a policy's scope covers a request.
 *
 * <p>Global policies and policies without a scope target always apply. Resource-scoped
 * policies apply to the resource named by the target. Organization, department, team and
 * project scopes apply when the principal's attribute of the same name equals the target.
 */
@ApplicationScoped
public class PolicyScopeMatcher {

    private final AttributeProvider attributes;

    @Inject
    public PolicyScopeMatcher(AttributeProvider attributes) {
        this.attributes = attributes;
    }

    public boolean applies(PermissionPolicy policy, String principalId, Resource resource) {
        final var target = policy.scopeTarget();
        if (target == null || target.isBlank()) {
            return true;
        }
        switch (policy.scope()) {
            case GLOBAL:
                return true;
            case RESOURCE:
                return resource != null && target.equals(resource.id());
            default:
                return attributes.principalAttribute(principalId, policy.scope().value())
                        .map(target::equals)
                        .orElse(false);
        }
    }
}
