package linkgate.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven clock for deterministic tests of expiry and refill.
 * Safe to advance from one thread while others read it.
 */
public final class ManualClock implements Clock {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(seconds * NANOS_PER_SECOND);
    }
}
