package warden.core.service.authz;

import java.util.List;

import warden.core.model.authz.PermissionRule;
import warden.core.model.error.InvalidRuleException;

/**
 * Structural checks applied to policy rules before they are stored.
 */
final class PolicyValidator {

    private PolicyValidator() {}

    /**
     * Reject rules containing a condition with a blank attribute or value.
     *
     * @throws InvalidRuleException on the first malformed condition
     */
    static void validateRules(List<PermissionRule> rules) {
        if (rules == null) {
            return;
        }
        for (var rule : rules) {
            for (var condition : rule.conditions()) {
                if (!condition.isWellFormed()) {
                    throw new InvalidRuleException("Rule '%s' has a %s condition with an empty attribute or value"
                            .formatted(rule.id(), condition.type().value()));
                }
            }
        }
    }
}
