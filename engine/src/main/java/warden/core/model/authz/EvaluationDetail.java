package warden.core.model.authz;

import java.util.List;

/**
 * Trace of one (action, resource) pair within a composite evaluation.
 *
 * <p>{@code applicablePolicies} lists the policies consulted while evaluating the pair.
 * It is empty when a direct or role permission decided before policies were reached,
 * and when the decision came from the cache ({@link DecisionStep#CACHED}), since the
 * cache keeps only the outcome.
 */
public record EvaluationDetail(
        PermissionAction action,
        String resourceId,
        boolean granted,
        DecisionStep decidedBy,
        List<String> applicablePolicies) {

    public EvaluationDetail {
        applicablePolicies = applicablePolicies == null ? List.of() : List.copyOf(applicablePolicies);
    }
}
