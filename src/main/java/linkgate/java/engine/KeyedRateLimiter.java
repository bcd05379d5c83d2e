package linkgate.java.engine;

import linkgate.core.algorithms.token_bucket.TokenBucket;
import linkgate.core.clock.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe per-key rate limiter, one token bucket per client key.
 *
 * Features:
 * - Buckets created lazily on first sight of a key, never ahead of time
 * - Coarse lock on the key map, per-bucket monitor for consume/peek
 * - Approximate memory bound through {@link #cleanupOldBuckets()}
 *
 * Thread-safety:
 * - Lookup and creation-if-absent happen under one ReentrantLock, so two
 *   racing callers never get different buckets for the same key
 * - The bucket is consumed after the map lock is released; unrelated keys
 *   never contend on each other's counters
 * - Lock order is always map lock, then bucket monitor
 * - The limit is approximate across a sweep: a caller holding a bucket that
 *   cleanupOldBuckets() removes consumes from the detached bucket, so the
 *   key can be granted one request above capacity. Only full buckets are
 *   swept, so this never turns a reject into an allow.
 *
 * Usage example:
 * <pre>
 * RateLimiterConfig config = RateLimiterConfig.of(10, 60);
 * KeyedRateLimiter limiter = new KeyedRateLimiter(SystemClock.instance(), config);
 *
 * if (!limiter.isAllowed(clientAddress)) {
 *     // Reject: too many requests
 * }
 * int remaining = limiter.remaining(clientAddress);
 * </pre>
 */
public final class KeyedRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(KeyedRateLimiter.class);

    private final Clock clock;
    private final RateLimiterConfig config;
    private final ReentrantLock mapLock = new ReentrantLock();
    // Insertion order is the enumeration order used by cleanupOldBuckets()
    private final LinkedHashMap<String, TokenBucket> buckets = new LinkedHashMap<>();

    /**
     * Creates a new keyed limiter.
     *
     * @param clock Clock instance for refill timing (injected for testability)
     * @param config Capacity and window applied to every key
     * @throws IllegalArgumentException if any parameter is null
     */
    public KeyedRateLimiter(Clock clock, RateLimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.clock = clock;
        this.config = config;
    }

    /**
     * Consumes one token from the key's bucket.
     *
     * @param key Client identifier (e.g., IP address)
     * @return true if the unit of work may proceed, false if it must be rejected
     * @throws IllegalArgumentException if key is null
     */
    public boolean isAllowed(String key) {
        return getOrCreateBucket(key).consume(1);
    }

    /**
     * Returns the whole tokens left for a key. Advisory only: concurrent
     * callers may consume them before the caller acts on the value.
     *
     * @param key Client identifier
     * @return floor of the current token level
     * @throws IllegalArgumentException if key is null
     */
    public int remaining(String key) {
        return (int) Math.floor(getOrCreateBucket(key).peek());
    }

    /**
     * Drops half of the buckets that have refilled to capacity.
     *
     * A full bucket carries no state a fresh one wouldn't, so removing it is
     * invisible to its key. Victims are the first half of the full buckets in
     * enumeration (key insertion) order, not the least recently used.
     *
     * @return Number of buckets removed
     */
    public int cleanupOldBuckets() {
        mapLock.lock();
        try {
            List<String> full = new ArrayList<>();
            for (Map.Entry<String, TokenBucket> e : buckets.entrySet()) {
                if (e.getValue().isFull()) {
                    full.add(e.getKey());
                }
            }

            int toRemove = full.size() / 2;
            Iterator<String> it = full.iterator();
            for (int i = 0; i < toRemove; i++) {
                buckets.remove(it.next());
            }

            if (toRemove > 0) {
                log.debug("Removed {} of {} full buckets, {} keys still tracked",
                    toRemove, full.size(), buckets.size());
            }
            return toRemove;
        } finally {
            mapLock.unlock();
        }
    }

    /**
     * Returns the number of currently tracked keys.
     *
     * @return Number of buckets
     */
    public int size() {
        mapLock.lock();
        try {
            return buckets.size();
        } finally {
            mapLock.unlock();
        }
    }

    /**
     * Forgets every bucket. Keys seen afterwards start with a full bucket.
     */
    public void clear() {
        mapLock.lock();
        try {
            buckets.clear();
        } finally {
            mapLock.unlock();
        }
    }

    /**
     * Returns the configuration applied to new buckets.
     *
     * @return The configuration
     */
    public RateLimiterConfig config() {
        return config;
    }

    /**
     * Retrieves or creates the bucket for a key as one atomic step.
     *
     * @param key The key
     * @return Bucket for the key (never null)
     */
    private TokenBucket getOrCreateBucket(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        mapLock.lock();
        try {
            TokenBucket bucket = buckets.get(key);
            if (bucket == null) {
                bucket = new TokenBucket(clock, config.requestsPerWindow(), config.refillRate());
                buckets.put(key, bucket);
            }
            return bucket;
        } finally {
            mapLock.unlock();
        }
    }
}
