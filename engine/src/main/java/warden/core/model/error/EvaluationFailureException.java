package warden.core.model.error;

/**
 * Evaluation could not complete, for example because an attribute lookup failed.
 *
 * <p>Single decisions never propagate this; they fail closed instead.
 */
public class EvaluationFailureException extends AuthorizationException {

    public EvaluationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
