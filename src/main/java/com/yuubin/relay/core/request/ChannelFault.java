package com.yuubin.relay.core.request;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.exceptions.RelayException;

/**
 * A fault together with the connection generation that raised it.
 *
 * @param cause  The failure.
 * @param origin Scope of the generation that raised it, or null when the fault
 *               is not tied to a generation.
 */
public record ChannelFault(RelayException cause, CancellationScope origin) {

    /**
     * A fault is stale once its generation has been retired; the connection it
     * reports on is already gone.
     *
     * @return True if the originating generation was cancelled.
     */
    public boolean isStale() {
        return origin != null && origin.isCancelled();
    }
}
