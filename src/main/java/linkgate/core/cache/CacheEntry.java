package linkgate.core.cache;

/**
 * A cached value with its absolute expiry and access counter.
 *
 * Owned by the {@link BoundedTimedCache} that created it and only mutated
 * while that cache's monitor is held.
 *
 * @param <V> Value type
 */
final class CacheEntry<V> {

    private final V value;
    private final long expiresAtNanos;
    private long accessCount;

    CacheEntry(V value, long expiresAtNanos) {
        this.value = value;
        this.expiresAtNanos = expiresAtNanos;
    }

    V value() {
        return value;
    }

    long expiresAtNanos() {
        return expiresAtNanos;
    }

    long accessCount() {
        return accessCount;
    }

    /**
     * Expired strictly after the deadline; an entry read exactly at its
     * deadline is still live.
     */
    boolean isExpired(long nowNanos) {
        return nowNanos - expiresAtNanos > 0;
    }

    void recordAccess() {
        accessCount++;
    }
}
