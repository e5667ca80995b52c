package warden.core.model.audit;

import java.time.Instant;
import java.util.Map;

import warden.core.model.authz.ResourceType;

/**
 * One immutable record on the audit trail.
 *
 * <p>The sequence number is assigned on append and is strictly increasing,
 * so it orders entries even when timestamps collide.
 *
 * @param id           unique identifier
 * @param sequence     append order
 * @param timestamp    when the event happened
 * @param userId       principal checked, or actor of a change
 * @param action       event kind
 * @param resourceId   target resource, null when the event has none
 * @param resourceType target resource type, null when the event has none
 * @param result       granted or denied; changes are recorded as granted
 * @param context      flat context data (request metadata or change details)
 */
public record AuditEntry(
        String id,
        long sequence,
        Instant timestamp,
        String userId,
        AuditAction action,
        String resourceId,
        ResourceType resourceType,
        AuditResult result,
        Map<String, String> context) {

    public static final String CHANGED_BY = "changed_by";
    public static final String DETAILS = "details";

    public AuditEntry {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public AuditEntry withSequence(long newSequence) {
        return new AuditEntry(id, newSequence, timestamp, userId, action, resourceId, resourceType, result, context);
    }

    public boolean isDenied() {
        return result == AuditResult.DENIED;
    }

    public boolean isPermissionCheck() {
        return action == AuditAction.PERMISSION_CHECKED;
    }
}
