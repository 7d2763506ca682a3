package com.yuubin.relay.config;

import java.util.Objects;

/**
 * Configuration for the administration server (health checks and metrics).
 */
public class AdminConfig {
    private boolean enabled = false;
    private int port = 9090;
    /** Bind address for the admin server. Defaults to loopback. */
    private String bindAddress = "127.0.0.1";

    /**
     * Checks if the admin server is enabled.
     * 
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Gets the port for the admin server. Zero binds an ephemeral port.
     * 
     * @return the port number.
     */
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AdminConfig other)) {
            return false;
        }
        return enabled == other.enabled && port == other.port && Objects.equals(bindAddress, other.bindAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, port, bindAddress);
    }
}
