package warden.core.model.error;

/**
 * A policy contains a condition with a blank attribute or value.
 */
public class InvalidRuleException extends AuthorizationException {

    public InvalidRuleException(String message) {
        super(message);
    }
}
