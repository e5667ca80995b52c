package warden.core.service.authz.condition;

import java.util.Optional;

import warden.core.model.authz.ConditionType;

/**
 * Resolves the actual value a condition compares against, for one condition type.
 *
 * <p>Implementations are discovered as CDI beans; exactly one must exist per
 * {@link ConditionType}.
 */
public interface ConditionEvaluator {

    /**
     * The condition type this evaluator handles.
     */
    ConditionType type();

    /**
     * Resolve an attribute for the current evaluation.
     *
     * @param attribute the attribute name from the condition
     * @param context   evaluation inputs
     * @return the attribute value, or empty if it cannot be resolved
     */
    Optional<String> resolve(String attribute, EvaluationContext context);
}
