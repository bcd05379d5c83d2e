package linkgate.core.algorithms.token_bucket;

import org.junit.jupiter.api.Test;
import linkgate.core.clock.ManualClock;

import static org.junit.jupiter.api.Assertions.*;

public class TokenBucketTest {

    @Test
    void allowsUpToCapacity_thenRejects() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 10, 1.0); // 1 token/sec

        for (int i = 0; i < 10; i++) assertTrue(bucket.consume(1), "consume #" + i);
        assertFalse(bucket.consume(1));
    }

    @Test
    void refillsOverTime_deterministic() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 2, 2.0); // 2 tokens/sec

        assertTrue(bucket.consume(2));
        assertFalse(bucket.consume(1));

        clock.advanceNanos(500_000_000L); // +0.5s => +1 token
        assertTrue(bucket.consume(1));
    }

    @Test
    void peek_reportsRefilledLevel_cappedAtCapacity() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 10, 1.0);

        for (int i = 0; i < 10; i++) bucket.consume();
        assertEquals(0.0, bucket.peek(), 1e-9);

        clock.advanceSeconds(5);
        assertEquals(5.0, bucket.peek(), 1e-6);

        clock.advanceSeconds(3_600);
        assertEquals(10.0, bucket.peek(), 1e-9);
    }

    @Test
    void deniedConsume_leavesTokensUnchanged() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 5, 1.0);

        assertTrue(bucket.consume(3));
        assertFalse(bucket.consume(3));

        assertEquals(2.0, bucket.peek(), 1e-9);
        assertTrue(bucket.consume(2));
    }

    @Test
    void fractionalRefill_accumulatesAcrossCalls() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 10, 10.0 / 60); // 10 per minute

        for (int i = 0; i < 10; i++) bucket.consume();

        // Each step alone adds less than one token; together they add more
        clock.advanceSeconds(3);
        assertFalse(bucket.consume());
        assertEquals(0.5, bucket.peek(), 1e-6);
        clock.advanceSeconds(4);
        assertTrue(bucket.consume());
        assertEquals(1.0 / 6, bucket.peek(), 1e-6);
    }

    @Test
    void isFull_onlyAfterRefillReachesCapacity() {
        ManualClock clock = new ManualClock(0);
        TokenBucket bucket = new TokenBucket(clock, 4, 2.0);

        assertTrue(bucket.isFull());
        bucket.consume(2);
        assertFalse(bucket.isFull());

        clock.advanceMillis(999);
        assertFalse(bucket.isFull());
        clock.advanceMillis(10);
        assertTrue(bucket.isFull());
    }

    @Test
    void invalidArguments_rejected() {
        ManualClock clock = new ManualClock(0);

        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(clock, 0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(clock, 1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(null, 1, 1.0));

        TokenBucket bucket = new TokenBucket(clock, 1, 1.0);
        assertThrows(IllegalArgumentException.class, () -> bucket.consume(0));
    }
}
