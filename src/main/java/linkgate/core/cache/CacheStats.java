package linkgate.core.cache;

/**
 * Point-in-time statistics of a {@link BoundedTimedCache}.
 *
 * @param size Current number of entries (expired but not yet removed included)
 * @param maxSize Configured capacity
 * @param hits Successful lookups since creation or the last clear
 * @param misses Lookups of unknown or expired keys
 * @param hitRate hits / (hits + misses) * 100, or 0 when there were no lookups
 * @param totalRequests hits + misses
 */
public record CacheStats(
    int size,
    int maxSize,
    long hits,
    long misses,
    double hitRate,
    long totalRequests
) {
    static CacheStats of(int size, int maxSize, long hits, long misses) {
        long total = hits + misses;
        double hitRate = total > 0 ? (double) hits / total * 100.0 : 0.0;
        return new CacheStats(size, maxSize, hits, misses, hitRate, total);
    }
}
