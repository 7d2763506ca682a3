package com.yuubin.relay.core.data;

import java.io.IOException;
import java.net.Socket;
import java.time.Duration;

import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * Dials the data address directly and announces the task with a data-open
 * frame, so the peer can correlate the connection with the creation request.
 */
public class DirectDataConnector implements DataConnector {

    /** Tag of the first frame written on a direct data connection. */
    public static final int DATA_OPEN = 0x20;

    private final FrameCodec codec;
    private final Duration connectTimeout;

    public DirectDataConnector(FrameCodec codec, Duration connectTimeout) {
        this.codec = codec;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Socket connect(String dataAddress, byte[] taskData) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(AddressUtils.parse(dataAddress), (int) connectTimeout.toMillis());
            socket.setTcpNoDelay(true);
            codec.write(socket.getOutputStream(), DATA_OPEN, taskData);
            return socket;
        } catch (IOException | RuntimeException e) {
            IoUtils.closeQuietly(socket);
            throw e;
        }
    }
}
