package com.yuubin.relay.core.data;

import java.io.IOException;

/**
 * Takes over a freshly opened data connection, for example to relay a flow
 * through it. The connection is released once {@link #handle} returns or
 * throws, so an implementation that relays data blocks until the flow ends.
 */
@FunctionalInterface
public interface DataConnectionHandler {

    /** Only confirms that the connection could be opened. */
    DataConnectionHandler CONFIRM_ONLY = connection -> {
        // Released right away
    };

    /**
     * Uses the connection. Runs on a relay worker thread, never on the
     * dispatch loop.
     * 
     * @param connection The open connection.
     * @throws IOException If the flow fails.
     */
    void handle(DataConnection connection) throws IOException;
}
