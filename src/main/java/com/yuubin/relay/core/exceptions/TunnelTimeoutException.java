package com.yuubin.relay.core.exceptions;

/**
 * Raised by the keepalive monitor when nothing was received on the tunnel
 * within the probe timeout window.
 */
public class TunnelTimeoutException extends RelayException {
    /**
     * Constructs a new TunnelTimeoutException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public TunnelTimeoutException(String message) {
        super(message);
    }
}
