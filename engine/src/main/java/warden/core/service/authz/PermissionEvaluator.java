package warden.core.service.authz;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.model.authz.Decision;
import warden.core.model.authz.DecisionStep;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.PolicyOutcome;
import warden.core.model.authz.Resource;
import warden.core.service.authz.condition.ConditionMatcher;
import warden.core.service.authz.condition.EvaluationContext;

/**
 * Computes a decision from a policy snapshot.
 *
 * <p>Sources are consulted in a fixed order and the first one that applies decides:
 * <ol>
 *   <li>direct permissions of the principal</li>
 *   <li>permissions of the principal's active, unexpired roles, in assignment order</li>
 *   <li>active policies in scope, highest priority first</li>
 *   <li>resource-level grants naming the principal</li>
 *   <li>access control list entries naming the principal</li>
 *   <li>otherwise deny</li>
 * </ol>
 *
 * <p>Stateless and side-effect free: the same snapshot, request and time always
 * produce the same decision.
 */
@ApplicationScoped
public class PermissionEvaluator {

    private static final Comparator<PermissionPolicy> BY_PRIORITY_DESCENDING =
            Comparator.comparingInt((PermissionPolicy policy) -> policy.priority().level()).reversed();

    private final ConditionMatcher conditions;
    private final PolicyScopeMatcher scopes;

    @Inject
    public PermissionEvaluator(ConditionMatcher conditions, PolicyScopeMatcher scopes) {
        this.conditions = conditions;
        this.scopes = scopes;
    }

    public Decision evaluate(
            PolicySnapshot snapshot,
            String principalId,
            PermissionAction action,
            Resource resource,
            PermissionContext context,
            Instant now) {
        final var evaluation = new EvaluationContext(principalId, resource, context, now);
        final var effective = snapshot.effectivePermissions(principalId);

        for (var permission : effective.directPermissions()) {
            if (permission.covers(action, resource, principalId)
                    && conditions.allMatch(permission.conditions(), evaluation)) {
                return Decision.of(permission.granted(), DecisionStep.DIRECT_PERMISSION);
            }
        }

        for (var assignment : effective.assignments()) {
            if (!assignment.isEffective(now)) {
                continue;
            }
            final var role = snapshot.role(assignment.roleId());
            if (role.isEmpty()) {
                continue;
            }
            for (var permission : role.get().permissions()) {
                if (permission.covers(action, resource, principalId)
                        && conditions.allMatch(permission.conditions(), evaluation)) {
                    return Decision.of(permission.granted(), DecisionStep.ROLE);
                }
            }
        }

        final var applicable = applicablePolicies(snapshot, principalId, resource);
        final var applicableIds =
                applicable.stream().map(PermissionPolicy::id).toList();
        for (var policy : applicable) {
            final var outcome = evaluatePolicy(policy, evaluation);
            if (outcome.isApplicable()) {
                return new Decision(outcome == PolicyOutcome.GRANTED, DecisionStep.POLICY, applicableIds);
            }
        }

        final var resourcePermissions = snapshot.resourcePermissions(resource.id());
        if (resourcePermissions.isPresent()) {
            for (var grant : resourcePermissions.get().grants()) {
                if (grant.principalId().equals(principalId)
                        && grant.action() == action
                        && conditions.allMatch(grant.conditions(), evaluation)) {
                    return new Decision(grant.granted(), DecisionStep.RESOURCE_GRANT, applicableIds);
                }
            }
        }

        for (var acl : snapshot.accessControlLists(resource.id())) {
            for (var entry : acl.entries()) {
                if (entry.matches(principalId, action)) {
                    return new Decision(entry.granted(), DecisionStep.ACL, applicableIds);
                }
            }
        }

        return Decision.defaultDeny(applicableIds);
    }

    /**
     * Active policies whose scope covers the request, highest priority first.
     * Policies of equal priority keep their creation order.
     */
    List<PermissionPolicy> applicablePolicies(PolicySnapshot snapshot, String principalId, Resource resource) {
        return snapshot.policies().stream()
                .filter(PermissionPolicy::active)
                .filter(policy -> scopes.applies(policy, principalId, resource))
                .sorted(BY_PRIORITY_DESCENDING)
                .toList();
    }

    private PolicyOutcome evaluatePolicy(PermissionPolicy policy, EvaluationContext evaluation) {
        for (var rule : policy.rules()) {
            if (conditions.allMatch(rule.conditions(), evaluation)) {
                return rule.outcome();
            }
        }
        return PolicyOutcome.NOT_APPLICABLE;
    }
}
