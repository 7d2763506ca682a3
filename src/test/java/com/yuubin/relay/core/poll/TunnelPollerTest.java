package com.yuubin.relay.core.poll;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.SocketPair;
import com.yuubin.relay.core.constants.TunnelFrameType;
import com.yuubin.relay.core.exceptions.ProtocolException;
import com.yuubin.relay.core.keepalive.ReceiptTracker;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.request.Request;
import com.yuubin.relay.core.request.RequestType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class TunnelPollerTest {

    private final FrameCodec codec = new FrameCodec();
    private final DispatchInbox inbox = new DispatchInbox(16);
    private final CompletionTracker tracker = new CompletionTracker();
    private final CancellationScope scope = CancellationScope.root("tunnel");
    private final ReceiptTracker receipts = new ReceiptTracker();
    private final AtomicLong now = new AtomicLong(1_000);
    private SocketPair pair;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        pair = SocketPair.open();
        executor = Executors.newCachedThreadPool();
        tracker.begin();
        executor.execute(new TunnelPoller(pair.localConnection(codec), scope, tracker, inbox, Duration.ofMillis(20),
                receipts, now::get));
    }

    @AfterEach
    void tearDown() {
        scope.cancel();
        pair.close();
        executor.shutdownNow();
    }

    @Test
    void emitsConnectOkBeforeFirstFrame() throws Exception {
        assertThat(inbox.takeRequest(2, TimeUnit.SECONDS)).isEqualTo(Request.of(RequestType.TUNNEL_CONNECT_OK));
        assertThat(receipts.last()).isEmpty();
    }

    @Test
    void mapsEveryTunnelTag() throws Exception {
        OutputStream peer = pair.remote().getOutputStream();
        codec.write(peer, TunnelFrameType.TASK.getCode(), new byte[] { 1 });
        codec.write(peer, TunnelFrameType.PING.getCode(), null);
        codec.write(peer, TunnelFrameType.CREATE_SS_CONNECT.getCode(), new byte[] { 2 });
        codec.write(peer, TunnelFrameType.CREATE_SOCKS5_CONNECT.getCode(), new byte[] { 3 });
        codec.write(peer, TunnelFrameType.CREATE_DIRECT_CONNECT.getCode(), new byte[] { 4 });

        assertThat(take()).isEqualTo(Request.of(RequestType.TUNNEL_CONNECT_OK));
        assertThat(take()).isEqualTo(new Request(RequestType.TASK_RESULT, new byte[] { 1 }));
        assertThat(take()).isEqualTo(Request.of(RequestType.PING));
        assertThat(take()).isEqualTo(new Request(RequestType.CREATE_SS_CONNECT, new byte[] { 2 }));
        assertThat(take()).isEqualTo(new Request(RequestType.CREATE_SOCKS5_CONNECT, new byte[] { 3 }));
        assertThat(take()).isEqualTo(new Request(RequestType.CREATE_DIRECT_CONNECT, new byte[] { 4 }));
    }

    @Test
    void receipt_isRecordedForEveryAcceptedFrame() throws Exception {
        take();
        codec.write(pair.remote().getOutputStream(), TunnelFrameType.PING.getCode(), null);
        take();
        assertThat(receipts.last()).hasValue(1_000);

        now.set(5_000);
        codec.write(pair.remote().getOutputStream(), TunnelFrameType.TASK.getCode(), new byte[] { 9 });
        take();
        assertThat(receipts.last()).hasValue(5_000);
    }

    @Test
    void unknownTag_raisesOneFaultWithoutReceipt() throws Exception {
        take();
        codec.write(pair.remote().getOutputStream(), 0x55, null);

        assertThat(inbox.takeFault(ChannelRole.TUNNEL, 2, TimeUnit.SECONDS)).isInstanceOf(ProtocolException.class);
        assertThat(tracker.awaitIdle(2, TimeUnit.SECONDS)).isTrue();
        assertThat(inbox.pendingFaults(ChannelRole.TUNNEL)).isZero();
        assertThat(receipts.last()).isEmpty();
    }

    private Request take() throws InterruptedException {
        Request request = inbox.takeRequest(2, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        return request;
    }
}
