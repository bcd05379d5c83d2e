package linkgate.core.cache;

import linkgate.core.clock.Clock;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Size- and time-bounded cache with LRU eviction and per-entry TTL.
 *
 * This implementation provides:
 * - O(1) get/set/delete
 * - Access-order eviction: the least recently read or written key goes first
 * - Per-entry expiry, checked lazily on get and eagerly by cleanupExpired()
 * - Hit/miss accounting for stats()
 * - Optional eviction callback (capacity evictions only)
 *
 * Design:
 * - LinkedHashMap with accessOrder=true holds the recency order
 * - removeEldestEntry evicts exactly one entry when a new key overflows
 * - Every method is synchronized on the cache, so get's move-to-MRU and
 *   set's evict-on-overflow are atomic with respect to size and order
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public final class BoundedTimedCache<K, V> {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    // Half the nanos range keeps now - expiresAt from wrapping
    private static final long MAX_TTL_NANOS = Long.MAX_VALUE / 2;
    private static final long MAX_TTL_SECONDS = MAX_TTL_NANOS / NANOS_PER_SECOND;

    private final Clock clock;
    private final int maxSize;
    private final long defaultTtlSeconds;
    private final BiConsumer<K, V> evictionCallback;
    private final LinkedHashMap<K, CacheEntry<V>> map;

    private long hits;
    private long misses;

    /**
     * Creates a cache with the given capacity, default TTL and eviction callback.
     *
     * @param clock Time source for expiry
     * @param maxSize Maximum number of entries (must be > 0)
     * @param defaultTtlSeconds TTL applied by {@link #set(Object, Object)} (must be > 0)
     * @param evictionCallback Invoked when an entry is evicted for capacity (can be null)
     * @throws IllegalArgumentException if clock is null or a bound is not positive
     */
    public BoundedTimedCache(Clock clock, int maxSize, long defaultTtlSeconds, BiConsumer<K, V> evictionCallback) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be > 0");
        }

        this.clock = clock;
        this.maxSize = maxSize;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.evictionCallback = evictionCallback;

        // accessOrder=true: get() and put() of an existing key move it to the tail
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, CacheEntry<V>> eldest) {
                boolean shouldRemove = size() > BoundedTimedCache.this.maxSize;
                if (shouldRemove && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue().value());
                }
                return shouldRemove;
            }
        };
    }

    /**
     * Creates a cache without eviction callback.
     *
     * @param clock Time source for expiry
     * @param maxSize Maximum number of entries
     * @param defaultTtlSeconds Default TTL in seconds
     */
    public BoundedTimedCache(Clock clock, int maxSize, long defaultTtlSeconds) {
        this(clock, maxSize, defaultTtlSeconds, null);
    }

    /**
     * Retrieves a live value and marks it as most recently used.
     * An expired entry is removed and counted as a miss.
     *
     * @param key The key to look up
     * @return The value, or null if absent or expired
     */
    public synchronized V get(K key) {
        requireKey(key);

        CacheEntry<V> entry = map.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        if (entry.isExpired(clock.nowNanos())) {
            map.remove(key);
            misses++;
            return null;
        }

        entry.recordAccess();
        hits++;
        return entry.value();
    }

    /**
     * Inserts or replaces a value with the default TTL.
     *
     * @param key The key
     * @param value The value
     */
    public void set(K key, V value) {
        set(key, value, defaultTtlSeconds);
    }

    /**
     * Inserts or replaces a value with an explicit TTL.
     *
     * Replacing an existing key refreshes its expiry and recency without
     * changing the size. Inserting a new key into a full cache evicts the
     * least recently used entry. TTLs beyond about 146 years are clamped
     * to that bound.
     *
     * @param key The key
     * @param value The value
     * @param ttlSeconds Time-to-live in seconds (must be >= 0)
     */
    public synchronized void set(K key, V value, long ttlSeconds) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }

        long ttlNanos = ttlSeconds >= MAX_TTL_SECONDS ? MAX_TTL_NANOS : ttlSeconds * NANOS_PER_SECOND;
        long expiresAt = clock.nowNanos() + ttlNanos;
        map.put(key, new CacheEntry<>(value, expiresAt));
    }

    /**
     * Removes an entry. Absent keys are ignored.
     * Does NOT invoke the eviction callback.
     *
     * @param key The key to remove
     */
    public synchronized void delete(K key) {
        requireKey(key);
        map.remove(key);
    }

    /**
     * Removes every entry and resets hit/miss counters.
     */
    public synchronized void clear() {
        map.clear();
        hits = 0;
        misses = 0;
    }

    /**
     * Removes every entry whose expiry has passed, whether or not it is read again.
     *
     * @return Number of entries removed
     */
    public synchronized int cleanupExpired() {
        long now = clock.nowNanos();
        int removed = 0;

        // Iterating an access-ordered map does not reorder it
        Iterator<CacheEntry<V>> it = map.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Returns a snapshot of size and hit/miss counters. Does not touch recency.
     *
     * @return Current statistics
     */
    public synchronized CacheStats stats() {
        return CacheStats.of(map.size(), maxSize, hits, misses);
    }

    /**
     * Returns the current number of entries, expired ones not yet removed included.
     *
     * @return Number of entries
     */
    public synchronized int size() {
        return map.size();
    }

    /**
     * Returns how many times an entry has been read since it was last set.
     * Diagnostic only: O(n), and does not touch recency or counters.
     *
     * @param key The key
     * @return Access count, or -1 if the key is not present
     */
    synchronized long accessCount(K key) {
        requireKey(key);
        // map.get() would move the key to the MRU position
        for (Map.Entry<K, CacheEntry<V>> e : map.entrySet()) {
            if (e.getKey().equals(key)) {
                return e.getValue().accessCount();
            }
        }
        return -1L;
    }

    public int maxSize() {
        return maxSize;
    }

    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
