package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.SecurityAuditReport;
import warden.core.model.audit.SecurityMetrics;
import warden.core.model.audit.TimeRange;

/**
 * Port interface for audit trail analytics.
 */
public interface AuditReporting {

    /**
     * Build a security audit report over a time window.
     *
     * @param timeRange                the window
     * @param includePermissionChanges include the change log
     * @param includeAccessAttempts    include per-user and per-resource summaries
     * @param includeViolations        include detected violations
     * @return Uni with the report
     */
    Uni<SecurityAuditReport> generateSecurityAuditReport(
            TimeRange timeRange,
            boolean includePermissionChanges,
            boolean includeAccessAttempts,
            boolean includeViolations);

    /**
     * Compute headline security metrics over a time window.
     */
    Uni<SecurityMetrics> securityMetrics(TimeRange timeRange);

    /**
     * Query the audit trail.
     */
    Uni<List<AuditEntry>> findEntries(AuditQuery query);
}
