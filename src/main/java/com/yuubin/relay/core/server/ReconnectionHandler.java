package com.yuubin.relay.core.server;

import java.io.IOException;
import java.util.Optional;

import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.ConnectionManager;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.PluginFrameType;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.exceptions.SetupException;
import com.yuubin.relay.core.services.RelayMetrics;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reacts to a tunnel fault with a single re-setup attempt.
 * <p>
 * When the attempt fails the plugin is told once, with a zero-length
 * tunnel-reconnect-failed frame, and the failure is returned to the caller.
 * There is no retry; the next attempt is driven by the next tunnel fault or
 * by an external trigger.
 * </p>
 */
public class ReconnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReconnectionHandler.class);

    private final ConnectionManager connections;
    private final RelayMetrics metrics;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ReconnectionHandler(ConnectionManager connections, RelayMetrics metrics) {
        this.connections = connections;
        this.metrics = metrics;
    }

    /**
     * Handles one tunnel fault.
     * 
     * @param cause The fault that triggered the reconnect.
     * @throws SetupException If the tunnel could not be re-established; the
     *                        plugin has already been notified.
     */
    public void handle(RelayException cause) {
        if (AddressUtils.isBlank(connections.getAddress(ChannelRole.TUNNEL))) {
            log.warn("Tunnel fault ignored, no tunnel address to reconnect to: {}", cause.getMessage());
            return;
        }
        log.warn("Tunnel fault: {}. Reconnecting to {}", cause.getMessage(),
                connections.getAddress(ChannelRole.TUNNEL));
        try {
            connections.setup(ChannelRole.TUNNEL);
        } catch (SetupException e) {
            metrics.reconnect(false);
            notifyPlugin();
            throw e;
        }
        metrics.reconnect(true);
    }

    private void notifyPlugin() {
        Optional<FrameConnection> plugin = connections.current(ChannelRole.PLUGIN);
        if (plugin.isEmpty()) {
            log.warn("Tunnel reconnect failed and no plugin connection is attached to report it to");
            return;
        }
        try {
            plugin.get().send(PluginFrameType.TUNNEL_RECONNECT_FAILED.getCode(), IoUtils.EMPTY_BYTES);
        } catch (IOException e) {
            log.warn("Failed to report tunnel reconnect failure to plugin: {}", e.getMessage());
        }
    }
}
