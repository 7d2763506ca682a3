package com.yuubin.relay.core.exceptions;

/**
 * Base exception for all relay errors.
 */
public class RelayException extends RuntimeException {
    /**
     * Constructs a new RelayException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public RelayException(String message) {
        super(message);
    }

    /**
     * Constructs a new RelayException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
