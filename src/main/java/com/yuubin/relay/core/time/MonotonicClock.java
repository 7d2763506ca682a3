package com.yuubin.relay.core.time;

/**
 * Source of monotonic time for keepalive accounting.
 * <p>
 * Values are only meaningful as differences. Tests substitute a controlled
 * implementation to make the probe/timeout sequence deterministic.
 * </p>
 */
public interface MonotonicClock {

    /**
     * Returns the current tick in nanoseconds.
     * 
     * @return A monotonically non-decreasing nanosecond value.
     */
    long nowNanos();
}
