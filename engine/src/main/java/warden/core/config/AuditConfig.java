package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for audit analytics.
 *
 * <p>Configuration prefix: {@code warden.audit}
 */
@ConfigMapping(prefix = "warden.audit")
public interface AuditConfig {

    /**
     * Denied attempts by one principal within a report window above which an
     * excessive-denied-attempts violation is raised.
     *
     * @return threshold (default: 10)
     */
    @WithDefault("10")
    int violationThreshold();
}
