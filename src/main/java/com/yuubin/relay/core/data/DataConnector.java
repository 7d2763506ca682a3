package com.yuubin.relay.core.data;

import java.io.IOException;
import java.net.Socket;

/**
 * Transport-specific dialer behind one connection-creation kind.
 */
@FunctionalInterface
public interface DataConnector {

    /**
     * Opens the transport for one task.
     * 
     * @param dataAddress The configured data address ({@code host:port}).
     * @param taskData    The payload of the creation request.
     * @return A connected socket, ready for the task.
     * @throws IOException If the transport cannot be established.
     */
    Socket connect(String dataAddress, byte[] taskData) throws IOException;
}
