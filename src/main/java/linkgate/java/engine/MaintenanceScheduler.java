package linkgate.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps expired cache entries and idle rate limit buckets.
 *
 * Neither structure has a timer of its own: expired entries nobody reads
 * again, and buckets of clients that went away, stay in memory until a
 * sweep removes them. This class runs both sweeps on one daemon thread.
 *
 * Either collaborator may be null when its subsystem is disabled.
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final PopularityGatedCacheManager cacheManager;
    private final KeyedRateLimiter rateLimiter;
    private final long intervalSeconds;
    private final ScheduledExecutorService executor;

    /**
     * @param cacheManager Cache to sweep (can be null)
     * @param rateLimiter Limiter to sweep (can be null)
     * @param intervalSeconds Delay between sweeps (must be > 0)
     * @throws IllegalArgumentException if intervalSeconds <= 0
     */
    public MaintenanceScheduler(
        PopularityGatedCacheManager cacheManager,
        KeyedRateLimiter rateLimiter,
        long intervalSeconds
    ) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.cacheManager = cacheManager;
        this.rateLimiter = rateLimiter;
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "linkgate-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules the sweep at a fixed delay, first run after one interval.
     */
    public void start() {
        executor.scheduleWithFixedDelay(this::runSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Maintenance sweeps scheduled every {}s", intervalSeconds);
    }

    /**
     * Runs both sweeps on the calling thread.
     *
     * @return Total number of cache entries and buckets removed
     */
    public int runOnce() {
        int removed = 0;
        if (cacheManager != null) {
            int expired = cacheManager.cleanupExpired();
            if (expired > 0) {
                log.debug("Removed {} expired cache entries", expired);
            }
            removed += expired;
        }
        if (rateLimiter != null) {
            removed += rateLimiter.cleanupOldBuckets();
        }
        return removed;
    }

    /**
     * An exception escaping a scheduled task would cancel every later run.
     */
    private void runSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.warn("Maintenance sweep failed, will retry in {}s", intervalSeconds, e);
        }
    }

    /**
     * Stops scheduling and waits briefly for a running sweep.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void stop() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        try {
            stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
