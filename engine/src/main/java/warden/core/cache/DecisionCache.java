package warden.core.cache;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.DecisionCacheConfig;
import warden.core.model.authz.PermissionAction;

/**
 * Time-bounded cache of decisions keyed by principal, action and resource.
 *
 * <p>Entries expire after the configured TTL. Administrative changes remove the
 * entries they may affect: all entries of a principal, all entries of a resource,
 * or everything.
 */
@ApplicationScoped
public class DecisionCache {

    private static final Logger LOG = Logger.getLogger(DecisionCache.class);

    private final LocalCache<DecisionKey, Boolean> cache;

    @Inject
    public DecisionCache(DecisionCacheConfig config, Clock clock) {
        this(new CaffeineLocalCache<>(config.ttl(), config.maxEntries(), clock));
        LOG.infof("Decision cache initialized (ttl=%s, maxEntries=%d)", config.ttl(), config.maxEntries());
    }

    public DecisionCache(LocalCache<DecisionKey, Boolean> cache) {
        this.cache = cache;
    }

    public Optional<Boolean> get(String principalId, PermissionAction action, String resourceId) {
        return cache.get(new DecisionKey(principalId, action, resourceId));
    }

    public void put(String principalId, PermissionAction action, String resourceId, boolean granted) {
        cache.put(new DecisionKey(principalId, action, resourceId), granted);
    }

    public void clearForPrincipal(String principalId) {
        cache.invalidateIf(key -> key.principalId().equals(principalId));
        LOG.debugf("Cleared cached decisions for principal %s", principalId);
    }

    public void clearForResource(String resourceId) {
        cache.invalidateIf(key -> key.resourceId().equals(resourceId));
        LOG.debugf("Cleared cached decisions for resource %s", resourceId);
    }

    public void clearAll() {
        cache.invalidateAll();
        LOG.debug("Cleared all cached decisions");
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * Cache key. Printed as {@code principal:action:resource}.
     */
    public record DecisionKey(String principalId, PermissionAction action, String resourceId) {

        @Override
        public String toString() {
            return principalId + ":" + action.value() + ":" + resourceId;
        }
    }
}
