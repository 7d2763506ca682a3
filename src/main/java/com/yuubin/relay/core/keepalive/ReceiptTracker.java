package com.yuubin.relay.core.keepalive;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time of the last successful receipt on the tunnel.
 * Written by the tunnel poller (and the monitor when it starts), read by the
 * monitor. The stored value never moves backwards.
 */
public final class ReceiptTracker {

    private static final long NEVER = Long.MIN_VALUE;

    private final AtomicLong lastReceiptNanos = new AtomicLong(NEVER);

    /**
     * Records a receipt.
     * 
     * @param nowNanos Monotonic time of the receipt.
     */
    public void record(long nowNanos) {
        lastReceiptNanos.accumulateAndGet(nowNanos, Math::max);
    }

    /**
     * Returns the last recorded receipt.
     * 
     * @return Monotonic time of the last receipt, or empty if none yet.
     */
    public OptionalLong last() {
        long value = lastReceiptNanos.get();
        return value == NEVER ? OptionalLong.empty() : OptionalLong.of(value);
    }
}
