package warden.core.model.authz;

/**
 * Result of evaluating a single policy or rule.
 */
public enum PolicyOutcome {
    GRANTED,
    DENIED,
    NOT_APPLICABLE;

    public boolean isApplicable() {
        return this != NOT_APPLICABLE;
    }
}
