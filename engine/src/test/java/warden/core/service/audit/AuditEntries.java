package warden.core.service.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditResult;
import warden.core.model.authz.ResourceType;

/**
 * Builders for audit entries used across the audit tests.
 */
final class AuditEntries {

    static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private AuditEntries() {}

    static AuditEntry check(long sequence, String userId, String resourceId, boolean granted) {
        return new AuditEntry(
                UUID.randomUUID().toString(),
                sequence,
                T0.plusSeconds(sequence),
                userId,
                AuditAction.PERMISSION_CHECKED,
                resourceId,
                ResourceType.DOCUMENT,
                AuditResult.of(granted),
                Map.of());
    }

    static AuditEntry change(long sequence, String userId, AuditAction action) {
        return new AuditEntry(
                UUID.randomUUID().toString(),
                sequence,
                T0.plusSeconds(sequence),
                userId,
                action,
                null,
                null,
                AuditResult.GRANTED,
                Map.of(AuditEntry.CHANGED_BY, "admin-1", AuditEntry.DETAILS, action.value()));
    }

    /**
     * Permission checks for one user on one resource, the first {@code denied} of them denied.
     */
    static List<AuditEntry> checks(String userId, int total, int denied) {
        final List<AuditEntry> entries = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            entries.add(check(i + 1, userId, "doc-1", i >= denied));
        }
        return entries;
    }
}
