package warden.core.model.audit;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of event recorded on the audit trail.
 */
public enum AuditAction {
    PERMISSION_CHECKED,
    ROLE_ASSIGNED,
    ROLE_REVOKED,
    ROLE_CREATED,
    ROLE_UPDATED,
    ROLE_DELETED,
    POLICY_CREATED,
    POLICY_UPDATED,
    POLICY_DELETED,
    RESOURCE_PERMISSIONS_SET,
    ACL_CREATED,
    ACL_UPDATED,
    DIRECT_PERMISSION_GRANTED,
    DIRECT_PERMISSION_REVOKED;

    /**
     * Whether this action records a change to authorization state rather than a check.
     */
    public boolean isChangeAction() {
        return this != PERMISSION_CHECKED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditAction fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
