package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the decision cache.
 *
 * <p>Configuration prefix: {@code warden.cache.decisions}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code warden.cache.decisions.ttl} - how long a decision may be served from cache</li>
 *   <li>{@code warden.cache.decisions.max-entries} - maximum cached decisions</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_CACHE_DECISIONS_TTL} - e.g., "PT5M" for 5 minutes</li>
 *   <li>{@code WARDEN_CACHE_DECISIONS_MAX_ENTRIES} - e.g., "10000"</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden.cache.decisions")
public interface DecisionCacheConfig {

    /**
     * Time-to-live of a cached decision.
     *
     * <p>Mutations invalidate affected entries immediately, so the TTL only bounds
     * staleness caused by role expiry and attribute changes outside the engine.
     *
     * @return TTL duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Maximum number of cached decisions. Least recently used entries are
     * evicted first when exceeded.
     *
     * @return maximum entries (default: 10000)
     */
    @WithDefault("10000")
    long maxEntries();
}
