package linkgate.java.engine;

import linkgate.core.cache.BoundedTimedCache;
import linkgate.core.cache.CacheStats;
import linkgate.core.clock.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short code to destination cache that only admits popular destinations.
 *
 * Callers look up first; on a miss they resolve the destination themselves
 * and offer it back through {@link #admit} together with its current usage
 * count. Destinations below the popularity threshold are skipped silently,
 * which keeps capacity for hot links at the cost of a miss for cold ones.
 *
 * When a destination changes or is removed upstream, the caller must
 * {@link #invalidate} the short code before reporting success.
 *
 * Thread-safety: all state lives in the wrapped {@link BoundedTimedCache}.
 */
public final class PopularityGatedCacheManager {

    private static final Logger log = LoggerFactory.getLogger(PopularityGatedCacheManager.class);

    private final BoundedTimedCache<String, String> cache;
    private final long popularityThreshold;

    /**
     * Creates a manager with its own cache.
     *
     * @param clock Clock instance for expiry (injected for testability)
     * @param config Capacity, default TTL and admission threshold
     * @throws IllegalArgumentException if any parameter is null
     */
    public PopularityGatedCacheManager(Clock clock, CacheConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = new BoundedTimedCache<>(
            clock,
            config.maxSize(),
            config.defaultTtlSeconds(),
            (shortCode, destination) -> log.debug("Evicted least recently used short code {}", shortCode)
        );
        this.popularityThreshold = config.popularityThreshold();
    }

    /**
     * @param shortCode Short code
     * @return Cached destination, or null on a miss
     */
    public String lookup(String shortCode) {
        return cache.get(shortCode);
    }

    /**
     * Caches a destination with the default TTL if it is popular enough.
     *
     * @param shortCode Short code
     * @param destination Destination URL
     * @param observedUsage Current usage count of the short code
     * @return true if the destination was cached
     */
    public boolean admit(String shortCode, String destination, long observedUsage) {
        return admit(shortCode, destination, observedUsage, cache.defaultTtlSeconds());
    }

    /**
     * Caches a destination with an explicit TTL if it is popular enough.
     *
     * @param shortCode Short code
     * @param destination Destination URL
     * @param observedUsage Current usage count of the short code
     * @param ttlSeconds Time-to-live in seconds
     * @return true if the destination was cached, false if below threshold
     */
    public boolean admit(String shortCode, String destination, long observedUsage, long ttlSeconds) {
        if (observedUsage < popularityThreshold) {
            return false;
        }
        cache.set(shortCode, destination, ttlSeconds);
        log.debug("Admitted {} (usage {}, ttl {}s)", shortCode, observedUsage, ttlSeconds);
        return true;
    }

    /**
     * Drops a cached destination so stale data is never served.
     *
     * @param shortCode Short code
     */
    public void invalidate(String shortCode) {
        cache.delete(shortCode);
    }

    public void clear() {
        cache.clear();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * @return Number of expired destinations removed
     */
    public int cleanupExpired() {
        return cache.cleanupExpired();
    }

    public long popularityThreshold() {
        return popularityThreshold;
    }

    public long defaultTtlSeconds() {
        return cache.defaultTtlSeconds();
    }
}
