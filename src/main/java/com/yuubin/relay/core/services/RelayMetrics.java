package com.yuubin.relay.core.services;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.request.RequestType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer instrumentation for the relay core.
 * Meters are registered once up front and removed again by {@link #close()}.
 */
public class RelayMetrics {

    private final MeterRegistry registry;
    private final List<Meter> meters = new ArrayList<>();
    private final Map<RequestType, Counter> requests = new EnumMap<>(RequestType.class);
    private final Map<ChannelRole, Counter> faults = new EnumMap<>(ChannelRole.class);
    private final Counter reconnectSucceeded;
    private final Counter reconnectFailed;
    private final Counter probesSent;
    private final Counter dataOpened;
    private final Counter dataFailed;

    /**
     * Registers all relay meters.
     * 
     * @param registry The registry to register with.
     */
    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (RequestType type : RequestType.values()) {
            requests.put(type, track(Counter.builder("relay.requests")
                    .tag("type", type.name().toLowerCase())
                    .description("Requests handled by the dispatch loop")
                    .register(registry)));
        }
        for (ChannelRole role : ChannelRole.values()) {
            faults.put(role, track(Counter.builder("relay.faults")
                    .tag("role", role.label())
                    .description("Faults signalled by poll loops and the keepalive monitor")
                    .register(registry)));
        }
        this.reconnectSucceeded = track(Counter.builder("relay.tunnel.reconnects")
                .tag("outcome", "success")
                .description("Tunnel reconnect attempts")
                .register(registry));
        this.reconnectFailed = track(Counter.builder("relay.tunnel.reconnects")
                .tag("outcome", "failure")
                .description("Tunnel reconnect attempts")
                .register(registry));
        this.probesSent = track(Counter.builder("relay.keepalive.probes")
                .description("Keepalive probes written to the tunnel")
                .register(registry));
        this.dataOpened = track(Counter.builder("relay.data.connections")
                .tag("outcome", "success")
                .description("Data connection attempts")
                .register(registry));
        this.dataFailed = track(Counter.builder("relay.data.connections")
                .tag("outcome", "failure")
                .description("Data connection attempts")
                .register(registry));
    }

    public void requestDispatched(RequestType type) {
        requests.get(type).increment();
    }

    public void faultHandled(ChannelRole role) {
        faults.get(role).increment();
    }

    public void reconnect(boolean success) {
        (success ? reconnectSucceeded : reconnectFailed).increment();
    }

    public void probeSent() {
        probesSent.increment();
    }

    public void dataConnection(boolean success) {
        (success ? dataOpened : dataFailed).increment();
    }

    /**
     * Unregisters every meter created by this instance.
     */
    public void close() {
        for (Meter meter : meters) {
            registry.remove(meter);
        }
        meters.clear();
    }

    private <M extends Meter> M track(M meter) {
        meters.add(meter);
        return meter;
    }
}
