package warden.core.model.authz;

/**
 * An attribute-based predicate attached to a rule, permission or grant.
 *
 * <p>The value may reference {@code {{user.id}}}, which is replaced with the
 * requesting principal before comparison.
 *
 * @param type      where the attribute is read from
 * @param attribute attribute name
 * @param operator  comparison to apply
 * @param value     expected value
 */
public record PermissionCondition(
        ConditionType type, String attribute, ConditionOperator operator, String value) {

    public static final String PRINCIPAL_PLACEHOLDER = "{{user.id}}";

    public PermissionCondition {
        if (type == null) {
            throw new IllegalArgumentException("Condition type cannot be null");
        }
        if (operator == null) {
            operator = ConditionOperator.EQUALS;
        }
    }

    public static PermissionCondition of(
            ConditionType type, String attribute, ConditionOperator operator, String value) {
        return new PermissionCondition(type, attribute, operator, value);
    }

    /**
     * Resolve the expected value for a specific principal.
     */
    public String expectedValueFor(String principalId) {
        return value == null ? null : value.replace(PRINCIPAL_PLACEHOLDER, principalId);
    }

    /**
     * A condition is well formed when both its attribute and value are non-blank.
     */
    public boolean isWellFormed() {
        return attribute != null && !attribute.isBlank() && value != null && !value.isBlank();
    }
}
