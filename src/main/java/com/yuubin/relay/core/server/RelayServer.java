package com.yuubin.relay.core.server;

import java.io.Closeable;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.config.TimingConfig;
import com.yuubin.relay.core.boundary.FrameForwardingBoundary;
import com.yuubin.relay.core.boundary.PluginBoundary;
import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.ConnectionManager;
import com.yuubin.relay.core.connection.Dialer;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.connection.SocketDialer;
import com.yuubin.relay.core.data.DataConnection;
import com.yuubin.relay.core.data.DataConnectionFactory;
import com.yuubin.relay.core.data.DataConnectionHandler;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.exceptions.SetupException;
import com.yuubin.relay.core.keepalive.KeepaliveMonitor;
import com.yuubin.relay.core.keepalive.ReceiptTracker;
import com.yuubin.relay.core.poll.PluginPoller;
import com.yuubin.relay.core.poll.TunnelPoller;
import com.yuubin.relay.core.protocol.FrameCodec;
import com.yuubin.relay.core.request.ChannelFault;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.request.Request;
import com.yuubin.relay.core.services.RelayMetrics;
import com.yuubin.relay.core.time.MonotonicClock;
import com.yuubin.relay.core.time.SystemMonotonicClock;
import com.yuubin.relay.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The relay: owns both managed connections and runs the dispatch loop that
 * serializes every request and fault.
 * <p>
 * Lifecycle: {@link #start()} dials the plugin and queues an initial tunnel
 * fault, so the first tunnel dial happens inside {@link #loop()} and a failure
 * there is reported to the plugin like any later reconnect failure.
 * {@link #close()} cancels everything and waits for the background loops.
 * </p>
 */
public class RelayServer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private final TimingConfig timing;
    private final CancellationScope root = CancellationScope.root("relay");
    private final DispatchInbox inbox;
    private final ReceiptTracker receipts = new ReceiptTracker();
    private final MonotonicClock clock;
    private final ExecutorService executor;
    private final RelayMetrics metrics;
    private final ConnectionManager connections;
    private final ReconnectionHandler reconnection;
    private final DataConnectionFactory dataConnections;
    private final PluginBoundary boundary;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile DataConnectionHandler dataHandler = DataConnectionHandler.CONFIRM_ONLY;
    private volatile boolean tunnelReady;

    /**
     * Creates a server that dials over TCP and forwards tasks as frames.
     *
     * @param properties      The relay configuration; must be valid.
     * @param dataConnections Opens data connections on request of the tunnel.
     * @param registry        Where the relay counters are registered.
     */
    public RelayServer(RelayProperties properties, DataConnectionFactory dataConnections, MeterRegistry registry) {
        this(properties, dataConnections, registry,
                new SocketDialer(new FrameCodec(properties.getMaxFrameLength()),
                        properties.getTiming().dialTimeout()),
                SystemMonotonicClock.INSTANCE, FrameForwardingBoundary::new);
    }

    /**
     * Creates a server with explicit collaborators.
     *
     * @param properties      The relay configuration; must be valid.
     * @param dataConnections Opens data connections on request of the tunnel.
     * @param registry        Where the relay counters are registered.
     * @param dialer          Opens plugin and tunnel transports.
     * @param clock           Monotonic time for the keepalive monitor.
     * @param boundaryFactory Creates the plugin boundary from the connection
     *                        manager.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RelayServer(RelayProperties properties, DataConnectionFactory dataConnections, MeterRegistry registry,
            Dialer dialer, MonotonicClock clock, Function<ConnectionManager, PluginBoundary> boundaryFactory) {
        this.timing = properties.getTiming();
        this.inbox = new DispatchInbox(properties.getRequestQueueCapacity());
        this.clock = clock;
        this.dataConnections = dataConnections;
        this.metrics = new RelayMetrics(registry);
        this.executor = Executors.newCachedThreadPool(ThreadUtils.daemonFactory("relay-loop"));
        this.connections = new ConnectionManager(root, dialer, executor, this::createLoops,
                timing.drainWarnInterval(), properties.getPluginAddress(), properties.getControlAddress());
        this.reconnection = new ReconnectionHandler(connections, metrics);
        this.boundary = boundaryFactory.apply(connections);
    }

    /**
     * Dials the plugin and schedules the first tunnel dial.
     *
     * @throws SetupException If the plugin cannot be reached.
     */
    public void start() {
        connections.setup(ChannelRole.PLUGIN);
        inbox.raise(ChannelRole.TUNNEL, new RelayException("Tunnel not connected yet"));
        log.info("Relay started (plugin={}, tunnel={})", connections.getAddress(ChannelRole.PLUGIN),
                connections.getAddress(ChannelRole.TUNNEL));
    }

    /**
     * Runs the dispatch loop on the calling thread until the server is closed.
     * Each wake-up handles one item, faults before requests.
     */
    public void loop() {
        log.debug("Dispatch loop started");
        try {
            while (!root.isCancelled()) {
                if (inbox.awaitPending(timing.getReadTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                    dispatchNext();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Dispatch loop interrupted");
        }
        log.debug("Dispatch loop stopped");
    }

    private void dispatchNext() {
        if (root.isCancelled()) {
            return;
        }
        ChannelFault fault = inbox.pollFault(ChannelRole.PLUGIN);
        if (fault != null) {
            if (isCurrent(ChannelRole.PLUGIN, fault)) {
                handlePluginFault(fault.cause());
            }
            return;
        }
        fault = inbox.pollFault(ChannelRole.TUNNEL);
        if (fault != null) {
            if (isCurrent(ChannelRole.TUNNEL, fault)) {
                handleTunnelFault(fault.cause());
            }
            return;
        }
        Request request = inbox.pollRequest();
        if (request != null) {
            handleRequest(request);
        }
    }

    private boolean isCurrent(ChannelRole role, ChannelFault fault) {
        if (fault.isStale()) {
            log.debug("Ignoring {} fault from retired connection: {}", role.label(), fault.cause().getMessage());
            return false;
        }
        return true;
    }

    /**
     * Routes one request to its handler. Handler failures are logged and
     * counted; they never end the loop.
     *
     * @param request The request to handle.
     */
    public void handleRequest(Request request) {
        metrics.requestDispatched(request.type());
        switch (request.type()) {
            case PUSH_TASK -> deliver("push task", () -> boundary.onPushTask(request.taskData()));
            case TASK_RESULT -> deliver("task result", () -> boundary.onTaskResult(request.taskData()));
            case TUNNEL_CONNECT_OK -> {
                tunnelReady = true;
                log.info("Tunnel connected to {}", connections.current(ChannelRole.TUNNEL)
                        .map(FrameConnection::remoteAddress).orElse("(detached)"));
            }
            case PING -> log.trace("Keepalive probe received from tunnel");
            case CREATE_SS_CONNECT, CREATE_SOCKS5_CONNECT, CREATE_DIRECT_CONNECT -> openDataConnection(request);
        }
    }

    /**
     * Handles a tunnel fault by attempting one reconnect.
     *
     * @param fault The fault raised by a tunnel loop.
     */
    public void handleTunnelFault(RelayException fault) {
        metrics.faultHandled(ChannelRole.TUNNEL);
        tunnelReady = false;
        try {
            reconnection.handle(fault);
        } catch (SetupException e) {
            log.warn("Tunnel reconnect failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while reconnecting tunnel", e);
        }
    }

    /**
     * Handles a plugin fault: the plugin connection is retired and left down.
     *
     * @param fault The fault raised by the plugin poller.
     */
    public void handlePluginFault(RelayException fault) {
        metrics.faultHandled(ChannelRole.PLUGIN);
        log.warn("Plugin connection failed: {}. Plugin is down until reconnected", fault.getMessage());
        connections.retire(ChannelRole.PLUGIN);
    }

    /**
     * Re-establishes a role on request (console command, configuration
     * reload). A tunnel failure is reported to the plugin.
     *
     * @param role The role to reconnect.
     * @throws SetupException If the role cannot be reached.
     */
    public void reconnect(ChannelRole role) {
        if (role == ChannelRole.TUNNEL) {
            tunnelReady = false;
            reconnection.handle(new RelayException("Reconnect requested"));
        } else {
            connections.setup(role);
        }
    }

    /**
     * Applies plugin and tunnel addresses from new configuration.
     *
     * @param properties The reloaded configuration.
     * @return The roles whose address changed.
     */
    public Set<ChannelRole> updateAddresses(RelayProperties properties) {
        Set<ChannelRole> changed = EnumSet.noneOf(ChannelRole.class);
        applyAddress(ChannelRole.PLUGIN, properties.getPluginAddress(), changed);
        applyAddress(ChannelRole.TUNNEL, properties.getControlAddress(), changed);
        return changed;
    }

    private void applyAddress(ChannelRole role, String address, Set<ChannelRole> changed) {
        String normalized = address == null ? "" : address.trim();
        if (!Objects.equals(connections.getAddress(role), normalized)) {
            log.info("{} address changed to '{}'", role.label(), normalized);
            connections.setAddress(role, address);
            changed.add(role);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping relay...");
        root.cancel();
        inbox.wakeUp();
        try {
            connections.retireAll();
        } catch (RelayException e) {
            log.warn("Failed to retire connections cleanly: {}", e.getMessage());
        }
        dataConnections.closeAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timing.getDrainWarnMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Relay loops did not terminate in time; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        metrics.close();
        log.info("Relay stopped");
    }

    /**
     * Sets who takes over data connections once they are open. Defaults to
     * {@link DataConnectionHandler#CONFIRM_ONLY}.
     *
     * @param dataHandler The handler.
     */
    public void setDataConnectionHandler(DataConnectionHandler dataHandler) {
        this.dataHandler = Objects.requireNonNull(dataHandler, "dataHandler");
    }

    public boolean isTunnelReady() {
        return tunnelReady;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ConnectionManager getConnections() {
        return connections;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public DispatchInbox getInbox() {
        return inbox;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ReceiptTracker getReceipts() {
        return receipts;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CancellationScope getRootScope() {
        return root;
    }

    private List<Runnable> createLoops(ChannelRole role, FrameConnection connection, CancellationScope scope,
            CompletionTracker tracker) {
        return switch (role) {
            case PLUGIN -> List.of(new PluginPoller(connection, scope, tracker, inbox, timing.readTimeout()));
            case TUNNEL -> List.of(
                    new TunnelPoller(connection, scope, tracker, inbox, timing.readTimeout(), receipts, clock),
                    new KeepaliveMonitor(connection, scope, tracker, inbox, receipts, clock, metrics,
                            timing.probeInterval(), timing.probeTimeout()));
        };
    }

    private void openDataConnection(Request request) {
        DataConnection connection;
        try {
            connection = dataConnections.create(request.type(), request.taskData());
        } catch (IOException | RelayException e) {
            metrics.dataConnection(false);
            log.warn("Failed to open {} data connection: {}", request.type(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            metrics.dataConnection(false);
            log.error("Data connection factory failed for {}", request.type(), e);
            return;
        }
        metrics.dataConnection(true);
        log.debug("Data connection ready for {}: {}", request.type(), connection.socket().getRemoteSocketAddress());

        try {
            executor.execute(() -> handOver(connection));
        } catch (RejectedExecutionException e) {
            log.debug("Relay is stopping, releasing {} data connection", request.type());
            dataConnections.release(connection);
        }
    }

    private void handOver(DataConnection connection) {
        try {
            dataHandler.handle(connection);
        } catch (IOException e) {
            log.warn("{} data connection failed: {}", connection.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Data connection handler failed for {}", connection.kind(), e);
        } finally {
            dataConnections.release(connection);
        }
    }

    private void deliver(String what, BoundaryCall call) {
        try {
            call.run();
        } catch (IOException e) {
            log.warn("Failed to deliver {}: {}", what, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Plugin boundary failed to deliver {}", what, e);
        }
    }

    @FunctionalInterface
    private interface BoundaryCall {
        void run() throws IOException;
    }
}
