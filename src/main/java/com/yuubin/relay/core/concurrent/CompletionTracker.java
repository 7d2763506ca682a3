package com.yuubin.relay.core.concurrent;

import java.util.concurrent.TimeUnit;

/**
 * Counts in-flight background loops so a caller can wait until all of them
 * have exited. Every {@link #begin()} must be matched by exactly one
 * {@link #done()}.
 */
public final class CompletionTracker {

    private int active;

    /**
     * Registers one more in-flight loop.
     */
    public synchronized void begin() {
        active++;
    }

    /**
     * Retires one in-flight loop, waking waiters when the count reaches zero.
     */
    public synchronized void done() {
        if (active == 0) {
            throw new IllegalStateException("done() called more often than begin()");
        }
        active--;
        if (active == 0) {
            notifyAll();
        }
    }

    /**
     * Waits until no loop is in flight.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit of the timeout.
     * @return True if the count reached zero within the timeout.
     * @throws InterruptedException If the waiting thread is interrupted.
     */
    public synchronized boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        long deadline = System.nanoTime() + remaining;
        while (active > 0) {
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
            remaining = deadline - System.nanoTime();
        }
        return true;
    }

    public synchronized int getActive() {
        return active;
    }
}
