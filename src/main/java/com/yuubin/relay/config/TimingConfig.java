package com.yuubin.relay.config;

import java.time.Duration;

/**
 * Timing knobs for the poll loops, keepalive monitor and connection setup.
 * All values are in milliseconds.
 */
public class TimingConfig {
    /** Bound for a single read attempt in the poll loops. */
    private long readTimeoutMillis = 200;

    /** Delay between keepalive probes on the tunnel. */
    private long probeIntervalMillis = 5000;

    /** Tunnel silence after which it is declared dead. */
    private long probeTimeoutMillis = 15000;

    /** Connect timeout for plugin and tunnel dials. */
    private long dialTimeoutMillis = 5000;

    /** How often to log while waiting for retired loops to exit. */
    private long drainWarnMillis = 5000;

    public long getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public void setReadTimeoutMillis(long readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
    }

    public long getProbeIntervalMillis() {
        return probeIntervalMillis;
    }

    public void setProbeIntervalMillis(long probeIntervalMillis) {
        this.probeIntervalMillis = probeIntervalMillis;
    }

    public long getProbeTimeoutMillis() {
        return probeTimeoutMillis;
    }

    public void setProbeTimeoutMillis(long probeTimeoutMillis) {
        this.probeTimeoutMillis = probeTimeoutMillis;
    }

    public long getDialTimeoutMillis() {
        return dialTimeoutMillis;
    }

    public void setDialTimeoutMillis(long dialTimeoutMillis) {
        this.dialTimeoutMillis = dialTimeoutMillis;
    }

    public long getDrainWarnMillis() {
        return drainWarnMillis;
    }

    public void setDrainWarnMillis(long drainWarnMillis) {
        this.drainWarnMillis = drainWarnMillis;
    }

    public Duration readTimeout() {
        return Duration.ofMillis(readTimeoutMillis);
    }

    public Duration probeInterval() {
        return Duration.ofMillis(probeIntervalMillis);
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(probeTimeoutMillis);
    }

    public Duration dialTimeout() {
        return Duration.ofMillis(dialTimeoutMillis);
    }

    public Duration drainWarnInterval() {
        return Duration.ofMillis(drainWarnMillis);
    }
}
