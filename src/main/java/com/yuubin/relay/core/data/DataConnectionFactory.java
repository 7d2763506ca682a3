package com.yuubin.relay.core.data;

import java.io.IOException;

import com.yuubin.relay.core.request.RequestType;

/**
 * Opens data connections for the connection-creation request kinds.
 */
public interface DataConnectionFactory {

    /**
     * Opens a data connection.
     * 
     * @param kind     One of {@link RequestType#CONNECTION_KINDS}.
     * @param taskData The opaque payload of the creation request.
     * @return The established connection.
     * @throws IOException If the connection cannot be opened.
     */
    DataConnection create(RequestType kind, byte[] taskData) throws IOException;

    /**
     * Hands back a connection its owner is done with. The connection is closed.
     * 
     * @param connection A connection returned by {@link #create}.
     */
    default void release(DataConnection connection) {
        connection.close();
    }

    /**
     * Closes every connection this factory still tracks.
     */
    default void closeAll() {
        // Nothing tracked by default
    }
}
