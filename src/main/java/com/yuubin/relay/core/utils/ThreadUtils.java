package com.yuubin.relay.core.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread creation helpers.
 */
public class ThreadUtils {

    private ThreadUtils() {
        // Utility class
    }

    /**
     * Creates a factory for named daemon threads ({@code prefix-1},
     * {@code prefix-2}, ...).
     * 
     * @param prefix Thread name prefix.
     * @return A thread factory.
     */
    public static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
