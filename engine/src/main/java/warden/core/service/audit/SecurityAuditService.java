package warden.core.service.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.ResourceAccessSummary;
import warden.core.model.audit.SecurityAuditReport;
import warden.core.model.audit.SecurityMetrics;
import warden.core.model.audit.TimeRange;
import warden.core.model.audit.UserActivitySummary;
import warden.core.port.in.AuditReporting;
import warden.core.port.out.AuditLogRepository;

/**
 * Builds security reports and metrics from the durable audit trail.
 *
 * <p>Check totals and activity summaries count permission checks only. The risk
 * assessment is computed over every entry in the window, changes included.
 */
@ApplicationScoped
public class SecurityAuditService implements AuditReporting {

    private static final Logger LOG = Logger.getLogger(SecurityAuditService.class);

    private final AuditLogRepository repository;
    private final ViolationDetector violationDetector;
    private final RiskAssessor riskAssessor;
    private final Clock clock;

    @Inject
    public SecurityAuditService(
            AuditLogRepository repository, ViolationDetector violationDetector, RiskAssessor riskAssessor, Clock clock) {
        this.repository = repository;
        this.violationDetector = violationDetector;
        this.riskAssessor = riskAssessor;
        this.clock = clock;
    }

    @Override
    public Uni<SecurityAuditReport> generateSecurityAuditReport(
            TimeRange timeRange,
            boolean includePermissionChanges,
            boolean includeAccessAttempts,
            boolean includeViolations) {
        if (timeRange == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Time range is required"));
        }

        return entriesIn(timeRange).map(entries -> {
            final var checks =
                    entries.stream().filter(AuditEntry::isPermissionCheck).toList();
            final long denied = checks.stream().filter(AuditEntry::isDenied).count();

            final var report = new SecurityAuditReport(
                    UUID.randomUUID().toString(),
                    timeRange,
                    clock.instant(),
                    checks.size(),
                    checks.size() - denied,
                    denied,
                    includePermissionChanges
                            ? entries.stream()
                                    .filter(entry -> entry.action().isChangeAction())
                                    .toList()
                            : List.of(),
                    includeViolations ? violationDetector.detect(entries) : List.of(),
                    includeAccessAttempts ? summarizeUsers(checks) : List.of(),
                    includeAccessAttempts ? summarizeResources(checks) : List.of(),
                    riskAssessor.assess(entries));

            LOG.infof(
                    "Generated security audit report %s for %s..%s: %d checks, %d denied, %d violations, risk %s",
                    report.id(),
                    timeRange.start(),
                    timeRange.end(),
                    report.totalPermissionChecks(),
                    report.deniedPermissions(),
                    report.violations().size(),
                    report.riskAssessment().level());
            return report;
        });
    }

    @Override
    public Uni<SecurityMetrics> securityMetrics(TimeRange timeRange) {
        if (timeRange == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Time range is required"));
        }

        return entriesIn(timeRange).map(entries -> {
            final var checks =
                    entries.stream().filter(AuditEntry::isPermissionCheck).toList();
            final long denied = checks.stream().filter(AuditEntry::isDenied).count();
            final long uniqueUsers = checks.stream()
                    .map(AuditEntry::userId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .count();
            final long uniqueResources = checks.stream()
                    .map(AuditEntry::resourceId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .count();
            final var risk = riskAssessor.assess(entries);
            return new SecurityMetrics(
                    checks.size(),
                    checks.size() - denied,
                    denied,
                    uniqueUsers,
                    uniqueResources,
                    100.0 - risk.riskScore(),
                    risk.level());
        });
    }

    @Override
    public Uni<List<AuditEntry>> findEntries(AuditQuery query) {
        return repository.find(query != null ? query : AuditQuery.all());
    }

    private Uni<List<AuditEntry>> entriesIn(TimeRange timeRange) {
        return repository.find(new AuditQuery(null, null, null, timeRange, 0));
    }

    private static List<UserActivitySummary> summarizeUsers(List<AuditEntry> checks) {
        final Map<String, List<AuditEntry>> byUser = checks.stream()
                .filter(entry -> entry.userId() != null)
                .collect(Collectors.groupingBy(AuditEntry::userId, LinkedHashMap::new, Collectors.toList()));

        return byUser.entrySet().stream()
                .map(e -> {
                    final var entries = e.getValue();
                    final long denied = entries.stream().filter(AuditEntry::isDenied).count();
                    return new UserActivitySummary(
                            e.getKey(),
                            entries.size(),
                            entries.size() - denied,
                            denied,
                            entries.stream()
                                    .map(AuditEntry::resourceId)
                                    .filter(Objects::nonNull)
                                    .distinct()
                                    .count(),
                            latest(entries));
                })
                .toList();
    }

    private static List<ResourceAccessSummary> summarizeResources(List<AuditEntry> checks) {
        final Map<String, List<AuditEntry>> byResource = checks.stream()
                .filter(entry -> entry.resourceId() != null)
                .collect(Collectors.groupingBy(AuditEntry::resourceId, LinkedHashMap::new, Collectors.toList()));

        return byResource.entrySet().stream()
                .map(e -> {
                    final var entries = e.getValue();
                    final long denied = entries.stream().filter(AuditEntry::isDenied).count();
                    return new ResourceAccessSummary(
                            e.getKey(),
                            entries.size(),
                            entries.size() - denied,
                            denied,
                            entries.stream()
                                    .map(AuditEntry::userId)
                                    .filter(Objects::nonNull)
                                    .distinct()
                                    .count(),
                            latest(entries));
                })
                .toList();
    }

    private static Instant latest(List<AuditEntry> entries) {
        return entries.stream()
                .map(AuditEntry::timestamp)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }
}
