package warden.core.service.authz;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.cache.DecisionCache;
import warden.core.model.audit.AuditAction;
import warden.core.model.authz.ResourceType;
import warden.core.model.error.AuthorizationException;
import warden.core.model.error.PersistenceFailureException;
import warden.core.port.out.AuthorizationMetrics;
import warden.core.service.audit.AuditTrail;

/**
 * Shared plumbing for administrative mutations: sequencing, mapping storage failures,
 * cache invalidation and change auditing.
 *
 * <p>Mutations submitted through {@link #serialized(Supplier)} run one at a time, in
 * subscription order. Each one validates against the policy store, persists and
 * applies its change before the next one starts, so no mutation acts on state that
 * another mutation has already replaced.
 */
@ApplicationScoped
public class AdministrativeChanges {

    private static final Logger LOG = Logger.getLogger(AdministrativeChanges.class);

    private final DecisionCache cache;
    private final AuditTrail auditTrail;
    private final AuthorizationMetrics metrics;
    private final AtomicReference<CompletableFuture<Void>> tail =
            new AtomicReference<>(CompletableFuture.completedFuture(null));

    @Inject
    public AdministrativeChanges(DecisionCache cache, AuditTrail auditTrail, AuthorizationMetrics metrics) {
        this.cache = cache;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
    }

    /**
     * Run a mutation once every previously subscribed mutation has terminated.
     *
     * <p>Waiting does not block a thread: the mutation is chained onto the completion
     * of its predecessor. Success, failure and cancellation all release the next one.
     * A serialized mutation must not subscribe to another serialized mutation.
     *
     * @param mutation check, persist and apply steps of one change
     * @return Uni with the mutation's result
     */
    public <T> Uni<T> serialized(Supplier<Uni<? extends T>> mutation) {
        return Uni.createFrom().deferred(() -> {
            final var done = new CompletableFuture<Void>();
            final var previous = tail.getAndSet(done);
            return Uni.createFrom()
                    .completionStage(previous)
                    .chain(() -> Uni.createFrom().deferred(mutation))
                    .onTermination()
                    .invoke(() -> done.complete(null));
        });
    }

    /**
     * Wrap a storage operation so that any failure surfaces as a
     * {@link PersistenceFailureException}.
     *
     * @param write       the storage operation
     * @param description what is being stored, for the error message
     */
    public <T> Uni<T> persist(Uni<T> write, String description) {
        return write.onFailure(failure -> !(failure instanceof AuthorizationException))
                .transform(failureMapper(description));
    }

    public void invalidatePrincipal(String principalId) {
        cache.clearForPrincipal(principalId);
        metrics.recordCacheInvalidation("principal");
    }

    public void invalidateResource(String resourceId) {
        cache.clearForResource(resourceId);
        metrics.recordCacheInvalidation("resource");
    }

    public void invalidateAll() {
        cache.clearAll();
        metrics.recordCacheInvalidation("all");
    }

    /**
     * Append a change to the audit trail.
     *
     * @param userId       principal the change concerns, or the actor for global changes
     * @param action       change kind
     * @param resourceId   affected resource, may be null
     * @param resourceType type of the affected resource, may be null
     * @param changedBy    acting principal
     * @param details      human-readable description
     */
    public void record(
            String userId,
            AuditAction action,
            String resourceId,
            ResourceType resourceType,
            String changedBy,
            String details) {
        auditTrail.recordChange(userId, action, resourceId, resourceType, changedBy, details);
        metrics.recordAdministrativeChange(action);
        LOG.infof("%s by %s: %s", action.value(), changedBy, details);
    }

    private static Function<Throwable, Throwable> failureMapper(String description) {
        return failure -> {
            LOG.warnf("Failed to persist %s: %s", description, failure.getMessage());
            return new PersistenceFailureException("Failed to persist " + description, failure);
        };
    }
}
