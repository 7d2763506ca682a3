package com.yuubin.relay.core.connection;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * {@link Dialer} that opens a plain TCP socket with a connect timeout.
 */
public class SocketDialer implements Dialer {

    private final FrameCodec codec;
    private final Duration connectTimeout;

    /**
     * Creates a dialer.
     * 
     * @param codec          The codec handed to every new connection.
     * @param connectTimeout Upper bound for the TCP handshake.
     */
    public SocketDialer(FrameCodec codec, Duration connectTimeout) {
        this.codec = codec;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public FrameConnection dial(String address) throws IOException {
        InetSocketAddress target = AddressUtils.parse(address);
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(target, (int) connectTimeout.toMillis());
            return new FrameConnection(socket, codec);
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "dial socket");
            throw e;
        }
    }
}
