package linkgate.java.engine;

/**
 * Configuration for a {@link PopularityGatedCacheManager}.
 *
 * @param maxSize Maximum cached destinations (must be > 0)
 * @param defaultTtlSeconds TTL of an admitted destination (must be > 0)
 * @param popularityThreshold Minimum observed usage to admit (must be >= 0)
 */
public record CacheConfig(
    int maxSize,
    long defaultTtlSeconds,
    long popularityThreshold
) {
    public CacheConfig {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
        if (defaultTtlSeconds <= 0) throw new IllegalArgumentException("defaultTtlSeconds must be > 0");
        if (popularityThreshold < 0) throw new IllegalArgumentException("popularityThreshold must be >= 0");
    }

    /**
     * Creates a cache configuration.
     *
     * @param maxSize Capacity
     * @param defaultTtlSeconds Default TTL in seconds
     * @param popularityThreshold Usage count needed for admission
     * @return Validated configuration
     */
    public static CacheConfig of(int maxSize, long defaultTtlSeconds, long popularityThreshold) {
        return new CacheConfig(maxSize, defaultTtlSeconds, popularityThreshold);
    }
}
