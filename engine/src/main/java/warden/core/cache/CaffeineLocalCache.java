package warden.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache implementation with a hard TTL.
 *
 * <p>
 * Expiration is measured against the supplied {@link Clock}, so entries never
 * outlive the TTL as seen by the rest of the engine. Expired entries are not
 * returned and are purged lazily on lookup and during Caffeine maintenance.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * Create a new cache driven by the system clock.
     *
     * @param ttl     the time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Clock.systemUTC());
    }

    /**
     * Create a new cache whose expiry follows the given clock.
     *
     * @param ttl     the time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     * @param clock   time source used to age entries
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        final Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateIf(Predicate<K> keyPredicate) {
        cache.asMap().keySet().removeIf(keyPredicate);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
