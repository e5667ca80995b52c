package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.config.TelemetryConfigMapping;
import warden.core.cache.CaffeineLocalCache;
import warden.core.cache.DecisionCache;
import warden.core.model.audit.AuditAction;
import warden.core.model.authz.DecisionStep;
import warden.core.model.authz.PermissionAction;

@DisplayName("MicrometerAuthorizationMetrics")
@ExtendWith(MockitoExtension.class)
class MicrometerAuthorizationMetricsTest {

    @Mock
    private TelemetryConfigMapping telemetryConfig;

    @Mock
    private TelemetryConfigMapping.MetricsConfig metricsConfig;

    private SimpleMeterRegistry registry;
    private DecisionCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        lenient().when(telemetryConfig.metrics()).thenReturn(metricsConfig);
        cache = new DecisionCache(new CaffeineLocalCache<>(Duration.ofMinutes(5), 100));
    }

    private MicrometerAuthorizationMetrics metrics(boolean telemetryEnabled, boolean metricsEnabled) {
        lenient().when(telemetryConfig.enabled()).thenReturn(telemetryEnabled);
        lenient().when(metricsConfig.enabled()).thenReturn(metricsEnabled);
        final var metrics = new MicrometerAuthorizationMetrics(registry, telemetryConfig, cache);
        metrics.init();
        return metrics;
    }

    @Nested
    @DisplayName("isEnabled")
    class IsEnabled {

        @Test
        @DisplayName("should return true when telemetry and metrics are enabled")
        void shouldReturnTrueWhenBothEnabled() {
            assertTrue(metrics(true, true).isEnabled());
        }

        @Test
        @DisplayName("should return false when telemetry is disabled")
        void shouldReturnFalseWhenTelemetryDisabled() {
            assertFalse(metrics(false, true).isEnabled());
        }

        @Test
        @DisplayName("should return false when metrics are disabled")
        void shouldReturnFalseWhenMetricsDisabled() {
            assertFalse(metrics(true, false).isEnabled());
        }
    }

    @Nested
    @DisplayName("when enabled")
    class WhenEnabled {

        @Test
        @DisplayName("should count decisions by outcome and deciding step")
        void shouldCountDecisions() {
            final var metrics = metrics(true, true);

            metrics.recordDecision(true, DecisionStep.ROLE, false, Duration.ofMillis(3));
            metrics.recordDecision(true, DecisionStep.ROLE, true, Duration.ofMillis(1));

            assertEquals(1.0, registry.get("warden.decisions.total")
                    .tag("outcome", "granted")
                    .tag("decided_by", "role")
                    .tag("cache_hit", "false")
                    .counter()
                    .count());
            assertEquals(1, registry.get("warden.decisions.latency")
                    .tag("cache_hit", "true")
                    .timer()
                    .count());
        }

        @Test
        @DisplayName("should count failures, invalidations and administrative changes")
        void shouldCountOtherEvents() {
            final var metrics = metrics(true, true);

            metrics.recordEvaluationFailure("EvaluationFailureException");
            metrics.recordCacheInvalidation("principal");
            metrics.recordCacheInvalidation("principal");
            metrics.recordAdministrativeChange(AuditAction.POLICY_CREATED);

            assertEquals(1.0, registry.get("warden.decisions.failures")
                    .tag("error_type", "EvaluationFailureException")
                    .counter()
                    .count());
            assertEquals(2.0, registry.get("warden.cache.invalidations")
                    .tag("scope", "principal")
                    .counter()
                    .count());
            assertEquals(1.0, registry.get("warden.admin.changes")
                    .tag("action", "policy_created")
                    .counter()
                    .count());
        }

        @Test
        @DisplayName("should report the decision cache size as a gauge")
        void shouldReportCacheSize() {
            metrics(true, true);
            cache.put("ann", PermissionAction.READ, "doc-1", true);

            assertEquals(1.0, registry.get("warden.cache.size").gauge().value());
        }
    }

    @Test
    @DisplayName("should register nothing when disabled")
    void shouldRegisterNothingWhenDisabled() {
        final var metrics = metrics(false, false);

        metrics.recordDecision(false, DecisionStep.DEFAULT_DENY, false, Duration.ofMillis(1));
        metrics.recordCacheInvalidation("all");

        assertNull(registry.find("warden.decisions.total").counter());
        assertNull(registry.find("warden.cache.size").gauge());
    }
}
