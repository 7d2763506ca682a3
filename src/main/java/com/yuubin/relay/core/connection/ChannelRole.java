package com.yuubin.relay.core.connection;

/**
 * The two managed peer roles.
 */
public enum ChannelRole {
    /** Local control connection: supplies tasks, receives status. */
    PLUGIN("plugin"),
    /** Connection to the remote peer: task results and keepalive traffic. */
    TUNNEL("tunnel");

    private final String label;

    ChannelRole(String label) {
        this.label = label;
    }

    /**
     * Retrieves the lower-case name used in logs and metric tags.
     * 
     * @return The role label.
     */
    public String label() {
        return label;
    }
}
