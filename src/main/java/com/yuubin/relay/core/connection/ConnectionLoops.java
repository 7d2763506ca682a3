package com.yuubin.relay.core.connection;

import java.util.List;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;

/**
 * Supplies the background loops that run against a freshly installed
 * connection. Each returned loop must call {@link CompletionTracker#done()}
 * exactly once when it exits; the caller registers it beforehand.
 */
@FunctionalInterface
public interface ConnectionLoops {

    /**
     * Creates the loops for one connection generation.
     * 
     * @param role       The role being installed.
     * @param connection The new transport.
     * @param scope      The scope that bounds the loops' lifetime.
     * @param tracker    The role's completion tracker.
     * @return Loops to start, in start order.
     */
    List<Runnable> create(ChannelRole role, FrameConnection connection, CancellationScope scope,
            CompletionTracker tracker);
}
