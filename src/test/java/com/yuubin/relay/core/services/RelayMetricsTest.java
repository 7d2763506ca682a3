package com.yuubin.relay.core.services;

import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.request.RequestType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelayMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final RelayMetrics metrics = new RelayMetrics(registry);

    @Test
    void counters_areTaggedByDimension() {
        metrics.requestDispatched(RequestType.CREATE_SS_CONNECT);
        metrics.faultHandled(ChannelRole.TUNNEL);
        metrics.reconnect(false);
        metrics.dataConnection(true);

        assertThat(registry.get("relay.requests").tag("type", "create_ss_connect").counter().count()).isEqualTo(1);
        assertThat(registry.get("relay.faults").tag("role", "tunnel").counter().count()).isEqualTo(1);
        assertThat(registry.get("relay.faults").tag("role", "plugin").counter().count()).isZero();
        assertThat(registry.get("relay.tunnel.reconnects").tag("outcome", "failure").counter().count()).isEqualTo(1);
        assertThat(registry.get("relay.data.connections").tag("outcome", "success").counter().count()).isEqualTo(1);
    }

    @Test
    void close_removesMeters() {
        metrics.close();

        assertThat(registry.find("relay.requests").counters()).isEmpty();
        assertThat(registry.getMeters()).isEmpty();
    }
}
