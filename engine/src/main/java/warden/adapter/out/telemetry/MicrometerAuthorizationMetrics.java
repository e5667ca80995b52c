package warden.adapter.out.telemetry;

import java.time.Duration;
import java.util.Locale;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.config.TelemetryConfigMapping;
import warden.core.cache.DecisionCache;
import warden.core.model.audit.AuditAction;
import warden.core.model.authz.DecisionStep;
import warden.core.port.out.AuthorizationMetrics;

/**
 * Records authorization metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.decisions.total} - Decisions by outcome and deciding step</li>
 *   <li>{@code warden.decisions.latency} - Time taken to reach a decision</li>
 *   <li>{@code warden.decisions.failures} - Evaluations that failed closed</li>
 *   <li>{@code warden.cache.invalidations} - Decision cache invalidations by scope</li>
 *   <li>{@code warden.cache.size} - Current decision cache size</li>
 *   <li>{@code warden.admin.changes} - Administrative changes by action</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthorizationMetrics implements AuthorizationMetrics {

    private final MeterRegistry registry;
    private final DecisionCache cache;
    private final boolean enabled;

    @Inject
    public MicrometerAuthorizationMetrics(
            MeterRegistry registry, TelemetryConfigMapping config, DecisionCache cache) {
        this.registry = registry;
        this.cache = cache;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("warden.cache.size", cache, DecisionCache::size)
                .description("Number of cached access decisions")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(boolean granted, DecisionStep decidedBy, boolean cacheHit, Duration duration) {
        if (!enabled) {
            return;
        }

        final var outcome = granted ? "granted" : "denied";
        Counter.builder("warden.decisions.total")
                .description("Total number of access decisions")
                .tag("outcome", outcome)
                .tag("decided_by", decidedBy.name().toLowerCase(Locale.ROOT))
                .tag("cache_hit", String.valueOf(cacheHit))
                .register(registry)
                .increment();

        Timer.builder("warden.decisions.latency")
                .description("Time taken to reach an access decision")
                .tag("cache_hit", String.valueOf(cacheHit))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    @Override
    public void recordEvaluationFailure(String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.decisions.failures")
                .description("Evaluations that failed and were denied")
                .tag("error_type", errorType == null ? "unknown" : errorType)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheInvalidation(String scope) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.cache.invalidations")
                .description("Decision cache invalidations")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAdministrativeChange(AuditAction action) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.admin.changes")
                .description("Administrative changes to roles, policies and resource permissions")
                .tag("action", action.value())
                .register(registry)
                .increment();
    }
}
