package linkgate.java.engine;

import linkgate.core.clock.ManualClock;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceSchedulerTest {

    @Test
    void testRunOnce_sweepsCacheAndLimiter() {
        ManualClock clock = new ManualClock(0L);
        PopularityGatedCacheManager cache = new PopularityGatedCacheManager(clock, CacheConfig.of(10, 60, 0));
        KeyedRateLimiter limiter = new KeyedRateLimiter(clock, RateLimiterConfig.of(5, 60));

        cache.admit("a", "https://a.example", 1, 1);
        cache.admit("b", "https://b.example", 1);
        limiter.remaining("idle-1");
        limiter.remaining("idle-2");

        clock.advanceSeconds(2);

        try (MaintenanceScheduler scheduler = new MaintenanceScheduler(cache, limiter, 60)) {
            // One expired entry plus half of two full buckets
            assertEquals(2, scheduler.runOnce());
        }

        assertEquals(1, cache.stats().size());
        assertEquals(1, limiter.size());
    }

    @Test
    void testRunOnce_disabledSubsystemsSkipped() {
        try (MaintenanceScheduler scheduler = new MaintenanceScheduler(null, null, 1)) {
            assertEquals(0, scheduler.runOnce());
        }
    }

    @Test
    void testStart_sweepsPeriodically() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        PopularityGatedCacheManager cache = new PopularityGatedCacheManager(clock, CacheConfig.of(10, 60, 0));
        cache.admit("a", "https://a.example", 1, 1);
        clock.advanceSeconds(2);

        MaintenanceScheduler scheduler = new MaintenanceScheduler(cache, null, 1);
        scheduler.start();
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (cache.stats().size() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(50);
            }
            assertEquals(0, cache.stats().size());
        } finally {
            scheduler.stop();
        }
    }

    @Test
    void testConfig_invalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new MaintenanceScheduler(null, null, 0));
    }
}
