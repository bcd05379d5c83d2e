package linkgate.java.engine;

import linkgate.core.clock.SystemClock;
import org.junit.jupiter.api.Test;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stress tests for the request path: rate limit check, cache lookup,
 * admission on miss.
 *
 * Note: These are stress tests, not precise benchmarks.
 * Throughput floors are deliberately low for CI environments; see the JMH
 * benchmarks for measurements.
 */
class AdmissionStressTest {

    @Test
    void testStress_singleThreadedRequestPath() {
        SystemClock clock = SystemClock.instance();
        KeyedRateLimiter limiter = new KeyedRateLimiter(clock, RateLimiterConfig.of(1_000_000, 1));
        PopularityGatedCacheManager cache = new PopularityGatedCacheManager(clock, CacheConfig.of(500, 3600, 2));

        int numRequests = 100_000;
        long startNanos = System.nanoTime();

        for (int i = 0; i < numRequests; i++) {
            String client = "client:" + (i % 100);
            String code = "code:" + (i % 1000);
            if (!limiter.isAllowed(client)) {
                continue;
            }
            if (cache.lookup(code) == null) {
                cache.admit(code, "https://example.com/" + code, i % 5);
            }
        }

        long elapsedNanos = System.nanoTime() - startNanos;
        double elapsedSeconds = elapsedNanos / 1_000_000_000.0;
        double throughput = numRequests / elapsedSeconds;

        System.out.printf("Single-threaded request path: %.0f req/s (%.3f ms total)%n",
            throughput, elapsedSeconds * 1000);

        assertTrue(cache.stats().size() <= 500);
        assertEquals(numRequests, cache.stats().totalRequests());
        assertTrue(throughput > 20_000,
            String.format("Expected > 20K req/s, got %.0f req/s", throughput));
    }

    @Test
    void testStress_multiThreadedRequestPath() throws InterruptedException {
        SystemClock clock = SystemClock.instance();
        KeyedRateLimiter limiter = new KeyedRateLimiter(clock, RateLimiterConfig.of(100, 1));
        PopularityGatedCacheManager cache = new PopularityGatedCacheManager(clock, CacheConfig.of(256, 3600, 0));

        int numThreads = 10;
        int requestsPerThread = 20_000;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicLong allowed = new AtomicLong(0);
        AtomicLong rejected = new AtomicLong(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        long startNanos = System.nanoTime();

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < requestsPerThread; j++) {
                        // Ten clients shared by all threads
                        String client = "client:" + ((threadId + j) % 10);
                        if (!limiter.isAllowed(client)) {
                            rejected.incrementAndGet();
                            continue;
                        }
                        allowed.incrementAndGet();
                        String code = "code:" + (j % 1_000);
                        if (cache.lookup(code) == null) {
                            cache.admit(code, "https://example.com/" + code, 1);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");

        long elapsedNanos = System.nanoTime() - startNanos;
        double elapsedSeconds = elapsedNanos / 1_000_000_000.0;

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        System.out.printf("Multi-threaded request path (%d threads): allowed %d, rejected %d in %.3f ms%n",
            numThreads, allowed.get(), rejected.get(), elapsedSeconds * 1000);

        assertEquals((long) numThreads * requestsPerThread, allowed.get() + rejected.get());

        // 10 clients, 100 burst each, 100 tokens/s refill
        long ceiling = 10L * (100 + (long) Math.ceil(elapsedSeconds * 100));
        assertTrue(allowed.get() <= ceiling,
            "Allowed " + allowed.get() + " exceeds token ceiling " + ceiling);
        assertTrue(allowed.get() >= 1_000, "Expected at least the initial bursts to pass");
        assertTrue(cache.stats().size() <= 256);
    }

    @Test
    void testStress_manyClientsBoundedBySweeps() {
        SystemClock clock = SystemClock.instance();
        KeyedRateLimiter limiter = new KeyedRateLimiter(clock, RateLimiterConfig.of(10, 60));

        // Every client looks once, leaving a full bucket behind
        for (int i = 0; i < 10_000; i++) {
            limiter.remaining("client:" + i);
        }
        assertEquals(10_000, limiter.size());

        int sweeps = 0;
        while (limiter.size() > 1 && sweeps < 20) {
            limiter.cleanupOldBuckets();
            sweeps++;
        }

        System.out.printf("Tracked keys after %d sweeps: %d%n", sweeps, limiter.size());

        // Each sweep halves the idle population
        assertEquals(1, limiter.size());
        assertEquals(14, sweeps);
    }
}
