package warden.core.port.out;

import java.time.Duration;

import warden.core.model.audit.AuditAction;
import warden.core.model.authz.DecisionStep;

/**
 * Port interface for recording authorization metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthorizationMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed decision.
     *
     * @param granted   the outcome
     * @param decidedBy precedence layer that decided, {@code CACHED} for cache hits
     * @param cacheHit  whether the decision was served from the cache
     * @param duration  time spent deciding
     */
    void recordDecision(boolean granted, DecisionStep decidedBy, boolean cacheHit, Duration duration);

    /**
     * Record a decision that failed internally and was denied.
     *
     * @param errorType exception class name
     */
    void recordEvaluationFailure(String errorType);

    /**
     * Record a cache invalidation.
     *
     * @param scope {@code principal}, {@code resource} or {@code all}
     */
    void recordCacheInvalidation(String scope);

    /**
     * Record an administrative change.
     *
     * @param action the change kind
     */
    void recordAdministrativeChange(AuditAction action);
}
