package warden.core.service.authz.condition;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.model.authz.ConditionType;
import warden.core.port.out.AttributeProvider;

/**
 * Reads principal attributes from the {@link AttributeProvider}. The attribute
 * {@code id} always resolves to the principal itself.
 */
@ApplicationScoped
public class UserAttributeEvaluator implements ConditionEvaluator {

    private final AttributeProvider attributes;

    @Inject
    public UserAttributeEvaluator(AttributeProvider attributes) {
        this.attributes = attributes;
    }

    @Override
    public ConditionType type() {
        return ConditionType.USER_ATTRIBUTE;
    }

    @Override
    public Optional<String> resolve(String attribute, EvaluationContext context) {
        if ("id".equals(attribute)) {
            return Optional.of(context.principalId());
        }
        return attributes.principalAttribute(context.principalId(), attribute);
    }
}
