package com.yuubin.relay.core.data;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.protocol.Frame;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.request.RequestType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderDataConnectionFactoryTest {

    private ServerSocket server;
    private ExecutorService executor;
    private ProviderDataConnectionFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        server = new ServerSocket(0, 10, InetAddress.getLoopbackAddress());
        server.setSoTimeout(5000);
        executor = Executors.newCachedThreadPool();
        RelayProperties props = new RelayProperties();
        props.setDataAddress("127.0.0.1:" + server.getLocalPort());
        props.getTiming().setDialTimeoutMillis(1000);
        factory = new ProviderDataConnectionFactory(props);
    }

    @AfterEach
    void tearDown() throws IOException {
        factory.closeAll();
        server.close();
        executor.shutdownNow();
    }

    @Test
    void socks5_performsNoAuthConnectToPayloadTarget() throws Exception {
        Future<String> proxy = executor.submit(() -> {
            try (Socket s = server.accept()) {
                DataInputStream in = new DataInputStream(s.getInputStream());
                DataOutputStream out = new DataOutputStream(s.getOutputStream());
                assertThat(in.readByte()).isEqualTo((byte) 5);
                assertThat(in.readByte()).isEqualTo((byte) 1);
                assertThat(in.readByte()).isEqualTo((byte) 0);
                out.write(new byte[] { 5, 0 });
                out.flush();

                assertThat(in.readByte()).isEqualTo((byte) 5);
                assertThat(in.readByte()).isEqualTo((byte) 1);
                in.readByte(); // RSV
                assertThat(in.readByte()).isEqualTo((byte) 3);
                byte[] host = new byte[in.readUnsignedByte()];
                in.readFully(host);
                int port = in.readUnsignedShort();

                out.write(new byte[] { 5, 0, 0, 1, 127, 0, 0, 1, 0x1F, (byte) 0x90 });
                out.flush();
                in.read(); // wait for the client to close
                return new String(host, StandardCharsets.UTF_8) + ":" + port;
            }
        });

        DataConnection connection = factory.create(RequestType.CREATE_SOCKS5_CONNECT,
                "example.org:443".getBytes(StandardCharsets.UTF_8));

        assertThat(connection.kind()).isEqualTo(RequestType.CREATE_SOCKS5_CONNECT);
        assertThat(connection.socket().isConnected()).isTrue();
        assertThat(factory.openConnections()).isEqualTo(1);
        factory.closeAll();
        assertThat(proxy.get(5, TimeUnit.SECONDS)).isEqualTo("example.org:443");
        assertThat(connection.socket().isClosed()).isTrue();
    }

    @Test
    void socks5_proxyRejection_failsAndClosesSocket() throws Exception {
        executor.submit(() -> {
            try (Socket s = server.accept()) {
                DataInputStream in = new DataInputStream(s.getInputStream());
                DataOutputStream out = new DataOutputStream(s.getOutputStream());
                in.readFully(new byte[3]);
                out.write(new byte[] { 5, 0 });
                out.flush();
                in.readFully(new byte[8]); // VER CMD RSV ATYP LEN 'a' PORT
                out.write(new byte[] { 5, 5, 0, 1, 0, 0, 0, 0, 0, 0 });
                out.flush();
                in.read();
            }
            return null;
        });

        assertThatThrownBy(() -> factory.create(RequestType.CREATE_SOCKS5_CONNECT,
                "a:1".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("reply 5");
        assertThat(factory.openConnections()).isZero();
    }

    @Test
    void socks5_malformedTarget_isRejected() {
        assertThatThrownBy(() -> factory.create(RequestType.CREATE_SOCKS5_CONNECT, new byte[0]))
                .isInstanceOf(RelayException.class);
    }

    @Test
    void direct_writesDataOpenFrame() throws Exception {
        Future<Frame> peer = executor.submit(() -> {
            try (Socket s = server.accept()) {
                return new FrameCodec().read(s.getInputStream());
            }
        });

        factory.create(RequestType.CREATE_DIRECT_CONNECT, new byte[] { 4, 2 });

        assertThat(peer.get(5, TimeUnit.SECONDS)).isEqualTo(new Frame(DirectDataConnector.DATA_OPEN, new byte[] { 4, 2 }));
    }

    @Test
    void release_closesAndStopsTracking() throws Exception {
        DataConnection connection = factory.create(RequestType.CREATE_DIRECT_CONNECT, new byte[] { 1 });
        assertThat(factory.openConnections()).isEqualTo(1);

        factory.release(connection);
        factory.release(connection);

        assertThat(factory.openConnections()).isZero();
        assertThat(connection.socket().isClosed()).isTrue();
    }

    @Test
    void shadowsocks_isServedByRegisteredProvider() throws Exception {
        Future<Integer> peer = executor.submit(() -> {
            try (Socket s = server.accept()) {
                return s.getInputStream().read();
            }
        });

        DataConnection connection = factory.create(RequestType.CREATE_SS_CONNECT, new byte[] { 7 });

        assertThat(connection.kind()).isEqualTo(RequestType.CREATE_SS_CONNECT);
        assertThat(peer.get(5, TimeUnit.SECONDS)).isEqualTo(7);
    }

    @Test
    void blankDataAddress_fails() {
        factory.setDataAddress(" ");

        assertThatThrownBy(() -> factory.create(RequestType.CREATE_DIRECT_CONNECT, new byte[0]))
                .isInstanceOf(RelayException.class)
                .hasMessageContaining("No data address");
    }

    @Test
    void nonCreationKind_isRejected() {
        assertThatThrownBy(() -> factory.create(RequestType.PING, new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.register(RequestType.TASK_RESULT, (address, data) -> new Socket()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
