package warden.core.model.error;

/**
 * A referenced role, assignment, policy, ACL, grant or parent resource does not exist.
 */
public class NotFoundException extends AuthorizationException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super("%s not found: %s".formatted(entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }
}
