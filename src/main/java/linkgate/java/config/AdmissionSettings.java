package linkgate.java.config;

import linkgate.java.engine.CacheConfig;
import linkgate.java.engine.RateLimiterConfig;

import java.util.Locale;
import java.util.Map;

/**
 * Process-level settings of the admission service, read from the environment.
 *
 * <p>Variables and defaults:
 * <ul>
 *   <li>PORT (9090)</li>
 *   <li>CACHE_ENABLED (true), CACHE_MAX_SIZE (1000), CACHE_TTL (3600), CACHE_POPULAR_THRESHOLD (10)</li>
 *   <li>RATE_LIMIT_ENABLED (true), RATE_LIMIT_REQUESTS (10), RATE_LIMIT_WINDOW (60)</li>
 *   <li>MAINTENANCE_INTERVAL_SECONDS (60)</li>
 * </ul>
 *
 * @param port gRPC listen port
 * @param cacheEnabled Whether lookups and admissions reach the cache
 * @param cache Cache configuration
 * @param rateLimitEnabled Whether rate limit checks consume tokens
 * @param rateLimiter Rate limiter configuration
 * @param maintenanceIntervalSeconds Delay between cleanup sweeps
 */
public record AdmissionSettings(
    int port,
    boolean cacheEnabled,
    CacheConfig cache,
    boolean rateLimitEnabled,
    RateLimiterConfig rateLimiter,
    long maintenanceIntervalSeconds
) {
    public static final int DEFAULT_PORT = 9090;

    public AdmissionSettings {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (cache == null) throw new IllegalArgumentException("cache cannot be null");
        if (rateLimiter == null) throw new IllegalArgumentException("rateLimiter cannot be null");
        if (maintenanceIntervalSeconds <= 0) throw new IllegalArgumentException("maintenanceIntervalSeconds must be > 0");
    }

    /**
     * @return Settings with every default applied
     */
    public static AdmissionSettings defaults() {
        return fromEnvironment(Map.of());
    }

    /**
     * Reads settings from the process environment.
     *
     * @return Parsed settings
     * @throws IllegalArgumentException if a variable is malformed or out of range
     */
    public static AdmissionSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads settings from the given variables, applying defaults for missing ones.
     *
     * @param env Variable name to value
     * @return Parsed settings
     * @throws IllegalArgumentException if a variable is malformed or out of range
     */
    public static AdmissionSettings fromEnvironment(Map<String, String> env) {
        CacheConfig cache = CacheConfig.of(
            intVar(env, "CACHE_MAX_SIZE", 1000),
            longVar(env, "CACHE_TTL", 3600L),
            longVar(env, "CACHE_POPULAR_THRESHOLD", 10L)
        );
        RateLimiterConfig limiter = RateLimiterConfig.of(
            intVar(env, "RATE_LIMIT_REQUESTS", 10),
            intVar(env, "RATE_LIMIT_WINDOW", 60)
        );

        return new AdmissionSettings(
            intVar(env, "PORT", DEFAULT_PORT),
            boolVar(env, "CACHE_ENABLED", true),
            cache,
            boolVar(env, "RATE_LIMIT_ENABLED", true),
            limiter,
            longVar(env, "MAINTENANCE_INTERVAL_SECONDS", 60L)
        );
    }

    /**
     * @param newPort Port to listen on
     * @return Copy of these settings with another port
     */
    public AdmissionSettings withPort(int newPort) {
        return new AdmissionSettings(newPort, cacheEnabled, cache, rateLimitEnabled, rateLimiter, maintenanceIntervalSeconds);
    }

    private static String raw(Map<String, String> env, String name) {
        String value = env.get(name);
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static int intVar(Map<String, String> env, String name, int fallback) {
        String value = raw(env, name);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    private static long longVar(Map<String, String> env, String name, long fallback) {
        String value = raw(env, name);
        if (value == null) return fallback;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    private static boolean boolVar(Map<String, String> env, String name, boolean fallback) {
        String value = raw(env, name);
        if (value == null) return fallback;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(name + " must be a boolean, got: " + value);
        };
    }
}
