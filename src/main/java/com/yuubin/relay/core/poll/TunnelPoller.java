package com.yuubin.relay.core.poll;

import java.time.Duration;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.TunnelFrameType;
import com.yuubin.relay.core.exceptions.ProtocolException;
import com.yuubin.relay.core.keepalive.ReceiptTracker;
import com.yuubin.relay.core.protocol.Frame;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.request.Request;
import com.yuubin.relay.core.request.RequestType;
import com.yuubin.relay.core.time.MonotonicClock;

/**
 * Read loop for the tunnel channel.
 * <p>
 * Emits {@link RequestType#TUNNEL_CONNECT_OK} before reading anything, so it
 * is always the first request of a fresh tunnel generation. Every accepted
 * frame, keepalive replies included, refreshes the last-receipt time.
 * </p>
 */
public class TunnelPoller extends AbstractPoller {

    private final ReceiptTracker receipts;
    private final MonotonicClock clock;

    public TunnelPoller(FrameConnection connection, CancellationScope scope, CompletionTracker tracker,
            DispatchInbox inbox, Duration readTimeout, ReceiptTracker receipts, MonotonicClock clock) {
        super(ChannelRole.TUNNEL, connection, scope, tracker, inbox, readTimeout);
        this.receipts = receipts;
        this.clock = clock;
    }

    @Override
    protected void onStart() throws InterruptedException {
        emit(Request.of(RequestType.TUNNEL_CONNECT_OK));
    }

    @Override
    protected void onReceived(Frame frame) {
        receipts.record(clock.nowNanos());
    }

    @Override
    protected Request toRequest(Frame frame) {
        TunnelFrameType type = TunnelFrameType.fromCode(frame.tag())
                .orElseThrow(() -> new ProtocolException("Unknown tunnel frame tag 0x" + Integer.toHexString(frame.tag())));
        return switch (type) {
            case TASK -> new Request(RequestType.TASK_RESULT, frame.payload());
            case PING -> Request.of(RequestType.PING);
            case CREATE_SS_CONNECT -> new Request(RequestType.CREATE_SS_CONNECT, frame.payload());
            case CREATE_SOCKS5_CONNECT -> new Request(RequestType.CREATE_SOCKS5_CONNECT, frame.payload());
            case CREATE_DIRECT_CONNECT -> new Request(RequestType.CREATE_DIRECT_CONNECT, frame.payload());
        };
    }
}
