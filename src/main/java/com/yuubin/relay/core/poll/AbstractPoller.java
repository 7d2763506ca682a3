package com.yuubin.relay.core.poll;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.protocol.Frame;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.request.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the per-role read loops.
 * <p>
 * Turns frames into {@link Request}s until the scope is cancelled or the
 * channel misbehaves. Every read attempt is bounded by the read timeout so
 * that cancellation is noticed even while the peer is silent. A bad frame or
 * an I/O failure raises exactly one fault for the role and ends the loop; a
 * cancelled loop exits silently. The completion tracker is decremented once
 * on every exit path.
 * </p>
 */
public abstract class AbstractPoller implements Runnable {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final ChannelRole role;
    private final FrameConnection connection;
    private final CancellationScope scope;
    private final CompletionTracker tracker;
    private final DispatchInbox inbox;
    private final Duration readTimeout;

    /**
     * Initializes the poller.
     * 
     * @param role        The role this loop reads for.
     * @param connection  The transport to read from.
     * @param scope       Scope bounding this loop.
     * @param tracker     The role's completion tracker; the caller has already
     *                    called {@link CompletionTracker#begin()}.
     * @param inbox       Destination for requests and faults.
     * @param readTimeout Bound for each read attempt.
     */
    protected AbstractPoller(ChannelRole role, FrameConnection connection, CancellationScope scope,
            CompletionTracker tracker, DispatchInbox inbox, Duration readTimeout) {
        this.role = role;
        this.connection = connection;
        this.scope = scope;
        this.tracker = tracker;
        this.inbox = inbox;
        this.readTimeout = readTimeout;
    }

    @Override
    public void run() {
        try {
            onStart();
            while (!scope.isCancelled()) {
                Optional<Frame> frame = connection.poll(readTimeout, scope);
                if (frame.isEmpty()) {
                    continue;
                }
                Request request = toRequest(frame.get());
                onReceived(frame.get());
                if (!emit(request)) {
                    break;
                }
            }
            log.debug("{} poller stopped: scope cancelled", role.label());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} poller interrupted", role.label());
        } catch (IOException | RelayException e) {
            if (scope.isCancelled()) {
                log.debug("{} poller stopped during shutdown: {}", role.label(), e.getMessage());
            } else {
                log.warn("{} channel failed, stopping poller: {}", role.label(), e.getMessage());
                RelayException fault = e instanceof RelayException re ? re
                        : new RelayException(role.label() + " channel I/O failure: " + e.getMessage(), e);
                inbox.raise(role, fault, scope);
            }
        } finally {
            tracker.done();
        }
    }

    /**
     * Hands a request to the dispatch loop, blocking while the queue is full.
     * 
     * @param request The request to deliver.
     * @return False if the scope was cancelled before the request was queued.
     * @throws InterruptedException If interrupted while waiting.
     */
    protected boolean emit(Request request) throws InterruptedException {
        while (!scope.isCancelled()) {
            if (inbox.offerRequest(request, readTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Called once before the first read.
     * 
     * @throws InterruptedException If interrupted while emitting.
     */
    protected void onStart() throws InterruptedException {
        // Nothing by default
    }

    /**
     * Called for every well-formed, accepted frame before it is emitted.
     * 
     * @param frame The frame just decoded.
     */
    protected void onReceived(Frame frame) {
        // Nothing by default
    }

    /**
     * Translates a frame using this role's tag table.
     * 
     * @param frame The decoded frame.
     * @return The matching request.
     * @throws com.yuubin.relay.core.exceptions.ProtocolException If the tag is
     *                                                            not valid for
     *                                                            this role.
     */
    protected abstract Request toRequest(Frame frame);

    public ChannelRole getRole() {
        return role;
    }
}
