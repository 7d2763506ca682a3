package com.yuubin.relay.core.data;

import java.io.Closeable;
import java.net.Socket;

import com.yuubin.relay.core.request.RequestType;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * A per-task transport opened on request of the tunnel peer.
 *
 * @param kind   The connection-creation kind that produced it.
 * @param socket The connected socket.
 */
public record DataConnection(RequestType kind, Socket socket) implements Closeable {

    @Override
    public void close() {
        IoUtils.closeQuietly(socket, kind + " data connection");
    }
}
