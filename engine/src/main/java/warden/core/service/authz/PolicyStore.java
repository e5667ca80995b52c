package warden.core.service.authz;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Holds the current {@link PolicySnapshot} and coordinates readers with writers.
 *
 * <p>Decisions run under the read lock so that a cache lookup, the evaluation and
 * the cache population all see one snapshot. Mutations run under the write lock
 * together with their cache invalidation, so no decision can observe a new
 * snapshot while stale cache entries for it still exist, and no decision computed
 * against the old snapshot can be cached after the invalidation.
 */
@ApplicationScoped
public class PolicyStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile PolicySnapshot current = PolicySnapshot.empty();

    /**
     * Current snapshot, without taking a lock. Suitable for read-only views.
     */
    public PolicySnapshot snapshot() {
        return current;
    }

    /**
     * Run a reader against the current snapshot while holding the read lock.
     *
     * @param reader function applied to the snapshot
     * @param <T>    result type
     * @return the reader's result
     */
    public <T> T read(Function<PolicySnapshot, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Apply a mutation and run the invalidation while holding the write lock.
     *
     * @param mutation     produces the next snapshot from the current one
     * @param invalidation cache invalidation for the mutation
     * @return the new snapshot
     */
    public PolicySnapshot apply(UnaryOperator<PolicySnapshot> mutation, Runnable invalidation) {
        lock.writeLock().lock();
        try {
            final var next = mutation.apply(current);
            current = next;
            invalidation.run();
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the whole snapshot, e.g. after loading from durable storage.
     */
    public void replace(PolicySnapshot snapshot, Runnable invalidation) {
        apply(ignored -> snapshot, invalidation);
    }
}
