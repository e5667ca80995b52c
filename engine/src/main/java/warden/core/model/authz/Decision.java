package warden.core.model.authz;

import java.util.List;

/**
 * Outcome of evaluating a single (principal, action, resource) request.
 *
 * @param granted             the final decision
 * @param decidedBy           precedence layer that produced it
 * @param applicablePolicies  ids of policies whose scope applied to the request
 */
public record Decision(boolean granted, DecisionStep decidedBy, List<String> applicablePolicies) {

    public Decision {
        applicablePolicies = applicablePolicies == null ? List.of() : List.copyOf(applicablePolicies);
    }

    public static Decision of(boolean granted, DecisionStep step) {
        return new Decision(granted, step, List.of());
    }

    public static Decision defaultDeny(List<String> applicablePolicies) {
        return new Decision(false, DecisionStep.DEFAULT_DENY, applicablePolicies);
    }

    public static Decision failure() {
        return new Decision(false, DecisionStep.EVALUATION_FAILURE, List.of());
    }
}
