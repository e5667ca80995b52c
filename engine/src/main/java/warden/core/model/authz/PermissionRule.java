package warden.core.model.authz;

import java.util.List;

/**
 * A conjunction of conditions producing an allow or deny effect.
 *
 * @param id         rule identifier, unique within its policy
 * @param conditions conditions that must all hold for the rule to apply
 * @param effect     effect when the rule applies
 */
public record PermissionRule(String id, List<PermissionCondition> conditions, RuleEffect effect) {

    public PermissionRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule ID cannot be null or blank");
        }
        if (effect == null) {
            throw new IllegalArgumentException("Rule effect cannot be null");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public PolicyOutcome outcome() {
        return effect == RuleEffect.ALLOW ? PolicyOutcome.GRANTED : PolicyOutcome.DENIED;
    }
}
