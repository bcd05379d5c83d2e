package linkgate.java.engine;

/**
 * Configuration for a {@link KeyedRateLimiter}.
 *
 * Each key gets a token bucket holding {@code requestsPerWindow} tokens that
 * refills continuously at {@code requestsPerWindow / windowSeconds} tokens per
 * second.
 *
 * @param requestsPerWindow Bucket capacity (must be > 0)
 * @param windowSeconds Time to refill an empty bucket (must be > 0)
 */
public record RateLimiterConfig(
    int requestsPerWindow,
    int windowSeconds
) {
    public RateLimiterConfig {
        if (requestsPerWindow <= 0) throw new IllegalArgumentException("requestsPerWindow must be > 0");
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
    }

    /**
     * Creates a configuration allowing {@code requests} per {@code windowSeconds}.
     *
     * @param requests Maximum burst, and requests per window at steady state
     * @param windowSeconds Window length in seconds
     * @return Validated configuration
     */
    public static RateLimiterConfig of(int requests, int windowSeconds) {
        return new RateLimiterConfig(requests, windowSeconds);
    }

    /**
     * @return Tokens added per second
     */
    public double refillRate() {
        return (double) requestsPerWindow / windowSeconds;
    }
}
