package com.yuubin.relay.config;

import com.yuubin.relay.core.exceptions.ConfigException;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.utils.AddressUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the relay.
 * Maps to the top-level structure of application.yml.
 */
public class RelayProperties {
    /**
     * Plugin control endpoint ({@code host:port}). Blank means the plugin
     * connection is attached externally.
     */
    private String pluginAddress = "";

    /**
     * Tunnel (control) endpoint of the remote peer. Blank means the tunnel is
     * attached externally and never redialed.
     */
    private String controlAddress = "";

    /**
     * Endpoint data connections are opened against.
     */
    private String dataAddress = "";

    /**
     * Capacity of the bounded request queue between the poll loops and the
     * dispatch loop.
     */
    private int requestQueueCapacity = 1024;

    /**
     * Largest accepted frame payload in bytes.
     */
    private int maxFrameLength = FrameCodec.DEFAULT_MAX_PAYLOAD_LENGTH;

    private TimingConfig timing = new TimingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    public String getPluginAddress() {
        return pluginAddress;
    }

    public void setPluginAddress(String pluginAddress) {
        this.pluginAddress = pluginAddress;
    }

    public String getControlAddress() {
        return controlAddress;
    }

    public void setControlAddress(String controlAddress) {
        this.controlAddress = controlAddress;
    }

    public String getDataAddress() {
        return dataAddress;
    }

    public void setDataAddress(String dataAddress) {
        this.dataAddress = dataAddress;
    }

    public int getRequestQueueCapacity() {
        return requestQueueCapacity;
    }

    public void setRequestQueueCapacity(int requestQueueCapacity) {
        this.requestQueueCapacity = requestQueueCapacity;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    public void setMaxFrameLength(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public TimingConfig getTiming() {
        return timing;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setTiming(TimingConfig timing) {
        this.timing = timing;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Checks the configuration for values the relay cannot run with.
     * 
     * @throws ConfigException describing the first problem found.
     */
    public void validate() {
        checkAddress("pluginAddress", pluginAddress);
        checkAddress("controlAddress", controlAddress);
        checkAddress("dataAddress", dataAddress);

        if (requestQueueCapacity <= 0) {
            throw new ConfigException("requestQueueCapacity must be positive, got " + requestQueueCapacity);
        }
        if (maxFrameLength <= 0) {
            throw new ConfigException("maxFrameLength must be positive, got " + maxFrameLength);
        }
        if (timing == null) {
            throw new ConfigException("timing section must not be null");
        }
        checkPositive("readTimeoutMillis", timing.getReadTimeoutMillis());
        checkPositive("probeIntervalMillis", timing.getProbeIntervalMillis());
        checkPositive("probeTimeoutMillis", timing.getProbeTimeoutMillis());
        checkPositive("dialTimeoutMillis", timing.getDialTimeoutMillis());
        checkPositive("drainWarnMillis", timing.getDrainWarnMillis());
        if (timing.getProbeTimeoutMillis() <= timing.getProbeIntervalMillis()) {
            throw new ConfigException("probeTimeoutMillis (" + timing.getProbeTimeoutMillis()
                    + ") must be longer than probeIntervalMillis (" + timing.getProbeIntervalMillis() + ")");
        }
        if (admin != null && (admin.getPort() < 0 || admin.getPort() > 65535)) {
            throw new ConfigException("admin.port out of range: " + admin.getPort());
        }
    }

    private static void checkAddress(String name, String value) {
        if (!AddressUtils.isBlank(value)) {
            try {
                AddressUtils.parseUnresolved(value);
            } catch (ConfigException e) {
                throw new ConfigException(name + ": " + e.getMessage(), e);
            }
        }
    }

    private static void checkPositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigException(name + " must be positive, got " + value);
        }
    }
}
