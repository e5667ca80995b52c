package warden.core.model.audit;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated security report over a time window.
 *
 * <p>Optional sections are empty lists when excluded by the report request.
 */
public record SecurityAuditReport(
        String id,
        TimeRange timeRange,
        Instant generatedAt,
        long totalPermissionChecks,
        long grantedPermissions,
        long deniedPermissions,
        List<AuditEntry> permissionChanges,
        List<SecurityViolation> violations,
        List<UserActivitySummary> userSummaries,
        List<ResourceAccessSummary> resourceSummaries,
        RiskAssessment riskAssessment) {

    public SecurityAuditReport {
        permissionChanges = permissionChanges == null ? List.of() : List.copyOf(permissionChanges);
        violations = violations == null ? List.of() : List.copyOf(violations);
        userSummaries = userSummaries == null ? List.of() : List.copyOf(userSummaries);
        resourceSummaries = resourceSummaries == null ? List.of() : List.copyOf(resourceSummaries);
    }
}
