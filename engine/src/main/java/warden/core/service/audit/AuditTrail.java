package warden.core.service.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditResult;
import warden.core.model.authz.PermissionAction;
import warden.core.model.authz.PermissionContext;
import warden.core.model.authz.Resource;
import warden.core.model.authz.ResourceType;
import warden.core.port.out.AuditLogRepository;

/**
 * Append-only audit trail for decisions and administrative changes.
 *
 * <p>Entries are numbered under a single lock and handed, in that order, to a
 * single writer thread that persists them. Callers never wait for persistence;
 * a failed write is logged and the entry is dropped from durable storage.
 */
@ApplicationScoped
public class AuditTrail {

    private static final Logger LOG = Logger.getLogger(AuditTrail.class);
    private static final Duration WRITE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    static final String REQUESTED_ACTION = "requested_action";

    private final AuditLogRepository repository;
    private final Clock clock;
    private final Executor writer;

    private long sequence;

    @Inject
    public AuditTrail(AuditLogRepository repository, Clock clock) {
        this(repository, clock, Executors.newSingleThreadExecutor(r -> {
            final var thread = new Thread(r, "audit-trail-writer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public AuditTrail(AuditLogRepository repository, Clock clock, Executor writer) {
        this.repository = repository;
        this.clock = clock;
        this.writer = writer;
    }

    @PreDestroy
    void shutdown() {
        if (writer instanceof ExecutorService executor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Audit trail writer did not drain before shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while draining audit trail writer");
            }
        }
    }

    /**
     * Continue numbering after entries already in durable storage.
     *
     * @param highestStored highest sequence number found in storage
     */
    public synchronized void resumeFrom(long highestStored) {
        if (highestStored > sequence) {
            sequence = highestStored;
            LOG.infof("Audit trail resuming at sequence %d", sequence);
        }
    }

    /**
     * Record a permission check.
     */
    public AuditEntry recordCheck(
            String principalId,
            PermissionAction action,
            Resource resource,
            boolean granted,
            PermissionContext context) {
        final Map<String, String> data = new LinkedHashMap<>();
        if (context != null) {
            data.putAll(context.toMap());
        }
        if (action != null) {
            data.put(REQUESTED_ACTION, action.value());
        }
        return append(new AuditEntry(
                UUID.randomUUID().toString(),
                0,
                clock.instant(),
                principalId,
                AuditAction.PERMISSION_CHECKED,
                resource != null ? resource.id() : null,
                resource != null ? resource.type() : null,
                AuditResult.of(granted),
                data));
    }

    /**
     * Record an administrative change.
     *
     * @param userId       principal the change concerns, or the actor for global changes
     * @param action       the change kind
     * @param resourceId   affected resource, may be null
     * @param resourceType type of the affected resource, may be null
     * @param changedBy    acting principal
     * @param details      human-readable description
     */
    public AuditEntry recordChange(
            String userId,
            AuditAction action,
            String resourceId,
            ResourceType resourceType,
            String changedBy,
            String details) {
        final Map<String, String> data = new LinkedHashMap<>();
        data.put(AuditEntry.CHANGED_BY, changedBy != null ? changedBy : "unknown");
        data.put(AuditEntry.DETAILS, details != null ? details : "");
        return append(new AuditEntry(
                UUID.randomUUID().toString(),
                0,
                clock.instant(),
                userId,
                action,
                resourceId,
                resourceType,
                AuditResult.GRANTED,
                data));
    }

    private synchronized AuditEntry append(AuditEntry draft) {
        final var entry = draft.withSequence(++sequence);
        try {
            writer.execute(() -> persist(entry));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Audit trail writer rejected entry %d (%s): %s", entry.sequence(), entry.action(), e.getMessage());
        }
        return entry;
    }

    private void persist(AuditEntry entry) {
        try {
            repository.append(entry).await().atMost(WRITE_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.warnf(
                    "Failed to persist audit entry %d (%s for %s): %s",
                    entry.sequence(),
                    entry.action(),
                    entry.userId(),
                    e.getMessage());
        }
    }
}
