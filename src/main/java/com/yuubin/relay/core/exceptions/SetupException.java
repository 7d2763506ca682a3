package com.yuubin.relay.core.exceptions;

import com.yuubin.relay.core.connection.ChannelRole;

/**
 * Thrown when a managed connection cannot be (re-)established.
 */
public class SetupException extends RelayException {

    private final ChannelRole role;
    private final String address;

    /**
     * Constructs a new SetupException for a failed dial.
     * 
     * @param role    the role that was being set up.
     * @param address the address that was dialed.
     * @param cause   the underlying failure.
     */
    public SetupException(ChannelRole role, String address, Throwable cause) {
        super("Failed to set up " + role.label() + " connection to " + address + ": " + cause.getMessage(), cause);
        this.role = role;
        this.address = address;
    }

    /**
     * Constructs a new SetupException without an underlying cause.
     * 
     * @param role    the role that was being set up.
     * @param address the configured address.
     * @param message the detail message.
     */
    public SetupException(ChannelRole role, String address, String message) {
        super(message);
        this.role = role;
        this.address = address;
    }

    public ChannelRole getRole() {
        return role;
    }

    public String getAddress() {
        return address;
    }
}
