package com.yuubin.relay.core.connection;

import java.io.IOException;

/**
 * Opens the transport for a managed role.
 */
@FunctionalInterface
public interface Dialer {

    /**
     * Connects to {@code address}.
     * 
     * @param address Target in {@code host:port} form.
     * @return A connected frame transport.
     * @throws IOException If the connection cannot be established.
     */
    FrameConnection dial(String address) throws IOException;
}
