package warden.core.service.authz.condition;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.model.authz.ConditionType;
import warden.core.port.out.AttributeProvider;

/**
 * Reads attributes of the target resource. Attributes carried on the request win
 * over those known to the {@link AttributeProvider}; {@code id} and {@code type}
 * resolve to the resource's own identity.
 */
@ApplicationScoped
public class ResourceAttributeEvaluator implements ConditionEvaluator {

    private final AttributeProvider attributes;

    @Inject
    public ResourceAttributeEvaluator(AttributeProvider attributes) {
        this.attributes = attributes;
    }

    @Override
    public ConditionType type() {
        return ConditionType.RESOURCE_ATTRIBUTE;
    }

    @Override
    public Optional<String> resolve(String attribute, EvaluationContext context) {
        final var resource = context.resource();
        if (resource == null) {
            return Optional.empty();
        }
        if ("id".equals(attribute)) {
            return Optional.of(resource.id());
        }
        if ("type".equals(attribute)) {
            return Optional.of(resource.type().value());
        }
        return resource.attribute(attribute).or(() -> attributes.resourceAttribute(resource.id(), attribute));
    }
}
