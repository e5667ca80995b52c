package warden.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryAuditLogRepository;
import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.audit.RiskLevel;
import warden.core.model.audit.TimeRange;

@DisplayName("SecurityAuditService")
class SecurityAuditServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final TimeRange ALL_DAY =
            new TimeRange(AuditEntries.T0, AuditEntries.T0.plus(Duration.ofDays(1)));

    private InMemoryAuditLogRepository repository;
    private SecurityAuditService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditLogRepository();
        final var clock = Clock.fixed(AuditEntries.T0.plus(Duration.ofDays(2)), ZoneOffset.UTC);
        service = new SecurityAuditService(repository, new ViolationDetector(10, clock), new RiskAssessor(), clock);
    }

    private void store(AuditEntry entry) {
        repository.append(entry).await().atMost(TIMEOUT);
    }

    private void storeAll(Iterable<AuditEntry> entries) {
        entries.forEach(this::store);
    }

    @Nested
    @DisplayName("generateSecurityAuditReport()")
    class ReportTests {

        @Test
        @DisplayName("totals count permission checks only")
        void totalsCountChecks() {
            store(AuditEntries.check(1, "ann", "doc-1", true));
            store(AuditEntries.check(2, "ann", "doc-2", false));
            store(AuditEntries.check(3, "bob", "doc-1", true));
            store(AuditEntries.change(4, "ann", AuditAction.ROLE_ASSIGNED));

            final var report = service.generateSecurityAuditReport(ALL_DAY, true, true, true)
                    .await().atMost(TIMEOUT);

            assertEquals(3, report.totalPermissionChecks());
            assertEquals(2, report.grantedPermissions());
            assertEquals(1, report.deniedPermissions());
            assertEquals(1, report.permissionChanges().size());
            assertEquals(AuditAction.ROLE_ASSIGNED, report.permissionChanges().get(0).action());
        }

        @Test
        @DisplayName("summaries group checks by user and by resource")
        void summaries() {
            store(AuditEntries.check(1, "ann", "doc-1", true));
            store(AuditEntries.check(2, "ann", "doc-2", false));
            store(AuditEntries.check(3, "bob", "doc-1", true));

            final var report = service.generateSecurityAuditReport(ALL_DAY, false, true, false)
                    .await().atMost(TIMEOUT);

            final var ann = report.userSummaries().get(0);
            assertEquals("ann", ann.userId());
            assertEquals(2, ann.totalChecks());
            assertEquals(1, ann.successful());
            assertEquals(1, ann.denied());
            assertEquals(2, ann.uniqueResources());
            assertEquals(AuditEntries.T0.plusSeconds(2), ann.lastActivity());

            final var doc1 = report.resourceSummaries().get(0);
            assertEquals("doc-1", doc1.resourceId());
            assertEquals(2, doc1.totalAccesses());
            assertEquals(2, doc1.uniqueUsers());
        }

        @Test
        @DisplayName("excluded sections are empty")
        void excludedSections() {
            storeAll(AuditEntries.checks("mallory", 12, 12));
            store(AuditEntries.change(13, "mallory", AuditAction.ROLE_REVOKED));

            final var report = service.generateSecurityAuditReport(ALL_DAY, false, false, false)
                    .await().atMost(TIMEOUT);

            assertTrue(report.permissionChanges().isEmpty());
            assertTrue(report.violations().isEmpty());
            assertTrue(report.userSummaries().isEmpty());
            assertTrue(report.resourceSummaries().isEmpty());
            assertEquals(12, report.deniedPermissions());
        }

        @Test
        @DisplayName("flags principals above the violation threshold")
        void violations() {
            storeAll(AuditEntries.checks("mallory", 12, 11));

            final var report = service.generateSecurityAuditReport(ALL_DAY, false, false, true)
                    .await().atMost(TIMEOUT);

            assertEquals(1, report.violations().size());
            assertEquals("mallory", report.violations().get(0).userId());
            assertEquals(RiskLevel.HIGH, report.riskAssessment().level());
        }

        @Test
        @DisplayName("entries outside the window are ignored")
        void windowed() {
            store(AuditEntries.check(1, "ann", "doc-1", false));
            final var later = new TimeRange(AuditEntries.T0.plusSeconds(60), AuditEntries.T0.plusSeconds(120));

            final var report = service.generateSecurityAuditReport(later, true, true, true)
                    .await().atMost(TIMEOUT);

            assertEquals(0, report.totalPermissionChecks());
            assertEquals(RiskLevel.LOW, report.riskAssessment().level());
        }

        @Test
        @DisplayName("a missing time range is rejected")
        void missingRange() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.generateSecurityAuditReport(null, true, true, true)
                            .await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("securityMetrics()")
    class MetricsTests {

        @Test
        @DisplayName("security score is the complement of the risk score")
        void securityScore() {
            storeAll(AuditEntries.checks("ann", 10, 2));
            store(AuditEntries.check(11, "bob", "doc-9", true));

            final var metrics = service.securityMetrics(ALL_DAY).await().atMost(TIMEOUT);

            assertEquals(11, metrics.totalChecks());
            assertEquals(9, metrics.granted());
            assertEquals(2, metrics.denied());
            assertEquals(2, metrics.uniqueUsers());
            assertEquals(2, metrics.uniqueResources());
            assertEquals(100.0 - (2.0 / 11 * 100), metrics.securityScore(), 1e-9);
            assertEquals(RiskLevel.MEDIUM, metrics.riskLevel());
        }
    }

    @Test
    @DisplayName("findEntries filters by result")
    void findEntries() {
        store(AuditEntries.check(1, "ann", "doc-1", true));
        store(AuditEntries.check(2, "ann", "doc-1", false));

        final var denied = service.findEntries(new AuditQuery(null, null, AuditResult.DENIED, null, 0))
                .await().atMost(TIMEOUT);

        assertEquals(1, denied.size());
        assertEquals(2, denied.get(0).sequence());
    }
}
