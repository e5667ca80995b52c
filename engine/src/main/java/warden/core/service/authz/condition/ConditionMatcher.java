package warden.core.service.authz.condition;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.authz.ConditionType;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.error.EvaluationFailureException;

/**
 * Evaluates conditions by dispatching to the {@link ConditionEvaluator} for their type.
 *
 * <p>A condition whose attribute cannot be resolved is false. A resolver that throws
 * aborts the evaluation with an {@link EvaluationFailureException}.
 */
@ApplicationScoped
public class ConditionMatcher {

    private static final Logger LOG = Logger.getLogger(ConditionMatcher.class);

    private final Map<ConditionType, ConditionEvaluator> evaluators = new EnumMap<>(ConditionType.class);

    @Inject
    public ConditionMatcher(@Any Instance<ConditionEvaluator> evaluators) {
        this((Iterable<ConditionEvaluator>) evaluators);
    }

    public ConditionMatcher(Iterable<ConditionEvaluator> evaluators) {
        for (var evaluator : evaluators) {
            final var previous = this.evaluators.put(evaluator.type(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate condition evaluator for " + evaluator.type() + ": "
                        + previous.getClass().getName() + ", " + evaluator.getClass().getName());
            }
        }
    }

    /**
     * Check whether every condition holds. An empty list holds trivially.
     */
    public boolean allMatch(List<PermissionCondition> conditions, EvaluationContext context) {
        for (var condition : conditions) {
            if (!matches(condition, context)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(PermissionCondition condition, EvaluationContext context) {
        final var evaluator = evaluators.get(condition.type());
        if (evaluator == null) {
            LOG.warnf("No evaluator registered for condition type %s; treating condition as false", condition.type());
            return false;
        }
        if (condition.attribute() == null || condition.value() == null) {
            return false;
        }

        final String actual;
        try {
            actual = evaluator.resolve(condition.attribute(), context).orElse(null);
        } catch (RuntimeException e) {
            throw new EvaluationFailureException(
                    "Failed to resolve %s attribute '%s'".formatted(condition.type().value(), condition.attribute()),
                    e);
        }
        if (actual == null) {
            return false;
        }
        return condition.operator().apply(actual, condition.expectedValueFor(context.principalId()));
    }
}
