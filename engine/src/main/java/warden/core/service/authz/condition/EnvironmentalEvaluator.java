package warden.core.service.authz.condition;

import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.model.authz.ConditionType;
import warden.core.model.authz.PermissionContext;

/**
 * Exposes facts about the caller's environment: location, device, user agent and IP.
 */
@ApplicationScoped
public class EnvironmentalEvaluator implements ConditionEvaluator {

    private static final Set<String> ENVIRONMENT_ATTRIBUTES = Set.of(
            PermissionContext.LOCATION,
            PermissionContext.DEVICE_ID,
            PermissionContext.USER_AGENT,
            PermissionContext.CLIENT_IP);

    @Override
    public ConditionType type() {
        return ConditionType.ENVIRONMENTAL;
    }

    @Override
    public Optional<String> resolve(String attribute, EvaluationContext context) {
        if (!ENVIRONMENT_ATTRIBUTES.contains(attribute)) {
            return Optional.empty();
        }
        return context.context().attribute(attribute);
    }
}
