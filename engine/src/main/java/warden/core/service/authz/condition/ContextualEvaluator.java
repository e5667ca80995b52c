package warden.core.service.authz.condition;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.model.authz.ConditionType;

@ApplicationScoped
public class ContextualEvaluator implements ConditionEvaluator {

    @Override
    public ConditionType type() {
        return ConditionType.CONTEXTUAL;
    }

    @Override
    public Optional<String> resolve(String attribute, EvaluationContext context) {
        return context.context().attribute(attribute);
    }
}
