package warden.core.model.authz;

/**
 * Precedence layer that produced a decision, in evaluation order.
 *
 * <p>{@link #CACHED} marks a decision served from the decision cache, and
 * {@link #EVALUATION_FAILURE} a denial caused by an internal error.
 */
public enum DecisionStep {
    DIRECT_PERMISSION,
    ROLE,
    POLICY,
    RESOURCE_GRANT,
    ACL,
    DEFAULT_DENY,
    EVALUATION_FAILURE,
    CACHED
}
