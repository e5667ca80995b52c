package warden.core.model.audit;

/**
 * Filter for audit trail queries. Null fields match everything.
 *
 * @param userId    restrict to one principal
 * @param action    restrict to one event kind
 * @param result    restrict to granted or denied
 * @param timeRange restrict to a window
 * @param limit     maximum entries returned, 0 for no limit
 */
public record AuditQuery(String userId, AuditAction action, AuditResult result, TimeRange timeRange, int limit) {

    public AuditQuery {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative");
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, 0);
    }

    public boolean matches(AuditEntry entry) {
        return (userId == null || userId.equals(entry.userId()))
                && (action == null || action == entry.action())
                && (result == null || result == entry.result())
                && (timeRange == null || timeRange.contains(entry.timestamp()));
    }
}
