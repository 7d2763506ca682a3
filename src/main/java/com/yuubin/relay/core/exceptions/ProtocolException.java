package com.yuubin.relay.core.exceptions;

/**
 * Thrown when a frame cannot be decoded or carries a tag the receiving channel
 * does not accept.
 */
public class ProtocolException extends RelayException {
    /**
     * Constructs a new ProtocolException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ProtocolException(String message) {
        super(message);
    }

    /**
     * Constructs a new ProtocolException with the specified detail message and
     * cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
