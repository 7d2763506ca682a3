package com.yuubin.relay.core.connection;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.protocol.Frame;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * Live transport for one managed role: a socket speaking the relay framing.
 * <p>
 * Reads are done by a single poll loop at a time. Writes may come from several
 * threads (dispatch loop, keepalive monitor) and are serialized so frames
 * never interleave on the wire.
 * </p>
 */
public class FrameConnection implements Closeable {

    private final Socket socket;
    private final FrameCodec codec;
    private final InputStream in;
    private final OutputStream out;
    private final Object writeLock = new Object();

    /**
     * Wraps a connected socket.
     * 
     * @param socket The connected socket.
     * @param codec  The codec for this channel.
     * @throws IOException If the socket streams cannot be obtained.
     */
    public FrameConnection(Socket socket, FrameCodec codec) throws IOException {
        this.socket = socket;
        this.codec = codec;
        // Unbuffered on purpose: a timed-out read must not swallow bytes.
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    /**
     * Makes one read attempt bounded by {@code deadline}.
     * 
     * @param deadline How long to wait for the first byte of a frame.
     * @param scope    Scope whose cancellation aborts a partially read frame.
     * @return The next frame, or empty if the deadline passed with no data.
     * @throws EOFException If the peer closed the connection.
     * @throws IOException  If the read fails or the frame is malformed.
     */
    public Optional<Frame> poll(Duration deadline, CancellationScope scope) throws IOException {
        socket.setSoTimeout((int) Math.max(1, deadline.toMillis()));
        int tag;
        try {
            tag = in.read();
        } catch (SocketTimeoutException e) {
            return Optional.empty();
        }
        if (tag < 0) {
            throw new EOFException("Peer closed the connection");
        }
        return Optional.of(codec.readBody(tag, new DeadlineInputStream(in, scope)));
    }

    /**
     * Writes one frame.
     * 
     * @param tag     The unsigned tag byte.
     * @param payload The payload, or null for a zero-length frame.
     * @throws IOException If the write fails.
     */
    public void send(int tag, byte[] payload) throws IOException {
        synchronized (writeLock) {
            codec.write(out, tag, payload);
        }
    }

    public boolean isClosed() {
        return socket.isClosed();
    }

    /**
     * Describes the remote end for log messages.
     * 
     * @return The remote socket address, or "unconnected".
     */
    public String remoteAddress() {
        return socket.getRemoteSocketAddress() != null ? socket.getRemoteSocketAddress().toString() : "unconnected";
    }

    @Override
    public void close() {
        IoUtils.closeQuietly(socket, "relay socket");
    }

    @Override
    public String toString() {
        return "FrameConnection[" + remoteAddress() + "]";
    }
}
