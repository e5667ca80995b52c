package warden.core.model.error;

/**
 * The durable store rejected or failed a write or read.
 */
public class PersistenceFailureException extends AuthorizationException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
