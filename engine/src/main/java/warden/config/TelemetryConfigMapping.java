package warden.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Telemetry is disabled by default. Example configuration:
 * <pre>{@code
 * warden.telemetry.enabled=true
 * warden.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable decision, cache and administration metrics.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
