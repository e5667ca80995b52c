package warden.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryAuditLogRepository;
import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;
import warden.core.model.authz.ResourceType;
import warden.core.port.out.AuditLogRepository;

@DisplayName("AuditTrail")
class AuditTrailTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final Clock clock = Clock.fixed(AuditEntries.T0, ZoneOffset.UTC);
    private InMemoryAuditLogRepository repository;
    private AuditTrail trail;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditLogRepository();
        trail = new AuditTrail(repository, clock, Runnable::run);
    }

    private List<AuditEntry> stored() {
        return repository.find(AuditQuery.all()).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("recordCheck()")
    class RecordCheckTests {

        @Test
        @DisplayName("records the outcome, resource and flattened context")
        void recordsCheck() {
            final var context = new PermissionContext(null, "10.0.4.2", null, null, null, null, Map.of());

            final var entry = trail.recordCheck(
                    "ann", PermissionAction.SHARE, Resource.of("doc-1", ResourceType.DOCUMENT), false, context);

            assertEquals(AuditAction.PERMISSION_CHECKED, entry.action());
            assertEquals(AuditResult.DENIED, entry.result());
            assertEquals("doc-1", entry.resourceId());
            assertEquals(ResourceType.DOCUMENT, entry.resourceType());
            assertEquals("share", entry.context().get(AuditTrail.REQUESTED_ACTION));
            assertEquals("10.0.4.2", entry.context().get(PermissionContext.CLIENT_IP));
            assertEquals(AuditEntries.T0, entry.timestamp());
            assertEquals(List.of(entry), stored());
        }
    }

    @Nested
    @DisplayName("sequencing")
    class SequencingTests {

        @Test
        @DisplayName("numbers entries from one in append order")
        void numbersFromOne() {
            trail.recordCheck("ann", PermissionAction.READ, Resource.of("doc-1", ResourceType.DOCUMENT), true, null);
            trail.recordChange("ann", AuditAction.ROLE_ASSIGNED, null, null, "admin-1", "Assigned role viewer");

            final var entries = stored();
            assertEquals(1, entries.get(0).sequence());
            assertEquals(2, entries.get(1).sequence());
            assertEquals("admin-1", entries.get(1).context().get(AuditEntry.CHANGED_BY));
            assertEquals("Assigned role viewer", entries.get(1).context().get(AuditEntry.DETAILS));
        }

        @Test
        @DisplayName("resumes after the highest stored sequence and never goes backwards")
        void resumes() {
            trail.resumeFrom(41);
            trail.resumeFrom(7);

            final var entry = trail.recordChange(null, AuditAction.POLICY_DELETED, null, null, null, "removed");

            assertEquals(42, entry.sequence());
            assertEquals("unknown", entry.context().get(AuditEntry.CHANGED_BY));
        }
    }

    @Nested
    @DisplayName("write failures")
    class WriteFailureTests {

        @Test
        @DisplayName("a failed write does not reach the caller")
        void failedWrite() {
            final var failing = mock(AuditLogRepository.class);
            when(failing.append(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("disk full")));
            final var failingTrail = new AuditTrail(failing, clock, Runnable::run);

            final var entry = failingTrail.recordChange(
                    "ann", AuditAction.ROLE_REVOKED, null, null, "admin-1", "Revoked role viewer");

            assertEquals(1, entry.sequence());
        }

        @Test
        @DisplayName("a rejected write still numbers the entry")
        void rejectedWrite() {
            final var rejecting = new AuditTrail(repository, clock, task -> {
                throw new RejectedExecutionException("shut down");
            });

            final var entry = rejecting.recordChange(
                    "ann", AuditAction.ROLE_REVOKED, null, null, "admin-1", "Revoked role viewer");

            assertEquals(1, entry.sequence());
            assertEquals(List.of(), stored());
        }
    }
}
