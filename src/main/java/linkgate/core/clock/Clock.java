package linkgate.core.clock;

/**
 * Monotonic time source, in nanoseconds.
 *
 * Every time-dependent structure (cache expiry, token refill) reads time
 * through this interface so tests can drive it with {@link ManualClock}.
 */
public interface Clock {
    long nowNanos();
}
