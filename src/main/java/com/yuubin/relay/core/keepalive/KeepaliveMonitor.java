package com.yuubin.relay.core.keepalive;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.TunnelFrameType;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.exceptions.TunnelTimeoutException;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.services.RelayMetrics;
import com.yuubin.relay.core.time.MonotonicClock;
import com.yuubin.relay.core.utils.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the tunnel and declares it dead when nothing has been received for
 * the timeout window.
 * <p>
 * Each cycle waits one probe interval, then either sends a keepalive probe or,
 * if the last receipt is at least {@code timeout} old, raises a
 * {@link TunnelTimeoutException} on the tunnel fault queue and stops. Attaching
 * to a connection counts as a receipt. Cancellation of the tunnel scope ends
 * the monitor silently.
 * </p>
 */
public class KeepaliveMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KeepaliveMonitor.class);

    private final FrameConnection connection;
    private final CancellationScope scope;
    private final CompletionTracker tracker;
    private final DispatchInbox inbox;
    private final ReceiptTracker receipts;
    private final MonotonicClock clock;
    private final RelayMetrics metrics;
    private final Duration interval;
    private final Duration timeout;

    /**
     * Creates a monitor for one tunnel generation.
     *
     * @param connection The tunnel transport probes are written to.
     * @param scope      The tunnel generation scope.
     * @param tracker    The tunnel completion tracker (already incremented).
     * @param inbox      Where the timeout fault is raised.
     * @param receipts   Shared last-receipt time.
     * @param clock      Monotonic time source.
     * @param metrics    Probe counter.
     * @param interval   Delay between probes.
     * @param timeout    Silence after which the tunnel is declared dead;
     *                   must be longer than {@code interval}.
     */
    public KeepaliveMonitor(FrameConnection connection, CancellationScope scope, CompletionTracker tracker,
            DispatchInbox inbox, ReceiptTracker receipts, MonotonicClock clock, RelayMetrics metrics,
            Duration interval, Duration timeout) {
        if (timeout.compareTo(interval) <= 0) {
            throw new IllegalArgumentException("Probe timeout must be longer than the probe interval");
        }
        this.connection = connection;
        this.scope = scope;
        this.tracker = tracker;
        this.inbox = inbox;
        this.receipts = receipts;
        this.clock = clock;
        this.metrics = metrics;
        this.interval = interval;
        this.timeout = timeout;
    }

    @Override
    public void run() {
        try {
            receipts.record(clock.nowNanos());
            while (!scope.awaitCancellation(interval.toNanos(), TimeUnit.NANOSECONDS)) {
                long now = clock.nowNanos();
                long silence = now - receipts.last().orElse(now);
                if (silence >= timeout.toNanos()) {
                    log.warn("No tunnel traffic for {} ms, declaring tunnel dead",
                            TimeUnit.NANOSECONDS.toMillis(silence));
                    inbox.raise(ChannelRole.TUNNEL, new TunnelTimeoutException(
                            "Tunnel keepalive timed out after " + timeout.toMillis() + " ms"), scope);
                    return;
                }
                connection.send(TunnelFrameType.PING.getCode(), IoUtils.EMPTY_BYTES);
                metrics.probeSent();
            }
            log.debug("Keepalive monitor stopped: scope cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Keepalive monitor interrupted");
        } catch (IOException e) {
            if (scope.isCancelled()) {
                log.debug("Keepalive probe aborted during shutdown: {}", e.getMessage());
            } else {
                log.warn("Failed to send keepalive probe: {}", e.getMessage());
                inbox.raise(ChannelRole.TUNNEL, new RelayException("Keepalive probe failed: " + e.getMessage(), e),
                        scope);
            }
        } finally {
            tracker.done();
        }
    }
}
