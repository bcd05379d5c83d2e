package linkgate.core.algorithms.token_bucket;

import linkgate.core.clock.Clock;

/**
 * Token Bucket:
 * - capacity: maximum tokens, also the starting level
 * - refillTokensPerSecond: continuous refill
 *
 * Tokens are real-valued so slow refill rates accumulate fractions between
 * calls. Refill is computed lazily from elapsed clock time on every access;
 * there is no background timer.
 *
 * Thread-safety: synchronized, so refill-then-consume is atomic per bucket.
 */
public final class TokenBucket {
    private final Clock clock;
    private final long capacity;
    private final double refillTokensPerSecond;
    private final double refillPerNanos;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, long capacity, double refillTokensPerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillTokensPerSecond <= 0) throw new IllegalArgumentException("refill <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillTokensPerSecond = refillTokensPerSecond;
        this.refillPerNanos = refillTokensPerSecond / 1_000_000_000d;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    /**
     * Takes one token if available.
     *
     * @return true if allowed
     */
    public boolean consume() {
        return consume(1);
    }

    /**
     * Takes n tokens if at least n are available; otherwise leaves the level unchanged.
     *
     * @param n Tokens to take (must be > 0)
     * @return true if allowed, false if denied
     */
    public synchronized boolean consume(int n) {
        if (n <= 0) throw new IllegalArgumentException("n <= 0");
        refill();

        if (tokens >= n) {
            tokens -= n;
            return true;
        }
        return false;
    }

    /**
     * Current token level after refill. Callers reporting quota truncate it.
     *
     * @return Tokens available, between 0 and capacity
     */
    public synchronized double peek() {
        refill();
        return tokens;
    }

    /**
     * @return true if the bucket has refilled to capacity
     */
    public synchronized boolean isFull() {
        refill();
        return tokens >= capacity;
    }

    public long capacity() {
        return capacity;
    }

    public double refillRate() {
        return refillTokensPerSecond;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillPerNanos);
        lastNanos = now;
    }
}
