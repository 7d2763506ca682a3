package com.yuubin.relay.core.connection;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.exceptions.ConfigException;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.exceptions.SetupException;
import com.yuubin.relay.core.utils.AddressUtils;
import com.yuubin.relay.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns dialing, replacing and tearing down the plugin and tunnel connections.
 * <p>
 * Every installation runs in three steps: retire the previous generation
 * (cancel its scope, wait until its loops have exited, close its socket),
 * install the new transport under a fresh child scope of the root, and start
 * the loops for it. All mutating operations are serialized on this manager,
 * so a role never has two generations of loops alive at once.
 * </p>
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final CancellationScope root;
    private final Dialer dialer;
    private final ExecutorService executor;
    private final ConnectionLoops loops;
    private final Duration drainWarnInterval;
    private final Map<ChannelRole, ManagedConnection> connections = new EnumMap<>(ChannelRole.class);

    /**
     * Creates a manager with both roles initially down.
     *
     * @param root              Root scope; every generation scope is a child.
     * @param dialer            Opens transports for {@link #setup(ChannelRole)}.
     * @param executor          Runs the per-connection loops.
     * @param loops             Creates the loops for a new generation.
     * @param drainWarnInterval How often to log while waiting for old loops.
     * @param pluginAddress     Initial plugin address; blank disables setup.
     * @param tunnelAddress     Initial tunnel address; blank disables setup.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ConnectionManager(CancellationScope root, Dialer dialer, ExecutorService executor, ConnectionLoops loops,
            Duration drainWarnInterval, String pluginAddress, String tunnelAddress) {
        this.root = root;
        this.dialer = dialer;
        this.executor = executor;
        this.loops = loops;
        this.drainWarnInterval = drainWarnInterval;
        connections.put(ChannelRole.PLUGIN, new ManagedConnection(ChannelRole.PLUGIN, pluginAddress));
        connections.put(ChannelRole.TUNNEL, new ManagedConnection(ChannelRole.TUNNEL, tunnelAddress));
    }

    /**
     * (Re-)establishes a role from its configured address.
     * A blank address means the role is wired externally; the call is a no-op.
     *
     * @param role The role to set up.
     * @throws SetupException If dialing fails. The role is left down.
     */
    public synchronized void setup(ChannelRole role) {
        ManagedConnection managed = connections.get(role);
        String address = managed.getAddress();
        if (AddressUtils.isBlank(address)) {
            log.debug("No {} address configured, skipping setup", role.label());
            return;
        }

        retire(role);

        FrameConnection fresh;
        try {
            fresh = dialer.dial(address);
        } catch (IOException | ConfigException e) {
            throw new SetupException(role, address, e);
        }
        install(managed, fresh);
        log.info("{} connection established to {}", role.label(), address);
    }

    /**
     * Installs an externally created transport for a role, replacing any
     * current one.
     *
     * @param role       The role to attach.
     * @param connection The transport to install.
     */
    public synchronized void attach(ChannelRole role, FrameConnection connection) {
        retire(role);
        install(connections.get(role), connection);
        log.info("{} connection attached ({})", role.label(), connection.remoteAddress());
    }

    /**
     * Stops the current generation of a role and closes its transport.
     * Returns once every loop of that generation has exited.
     *
     * @param role The role to retire.
     */
    public synchronized void retire(ChannelRole role) {
        ManagedConnection managed = connections.get(role);
        CancellationScope scope = managed.getScope();
        if (scope != null) {
            scope.cancel();
        }
        awaitDrain(managed);

        FrameConnection old = managed.getConnection();
        managed.clear();
        if (old != null) {
            IoUtils.closeQuietly(old, role.label() + " connection");
            log.debug("Retired {} connection {}", role.label(), old.remoteAddress());
        }
    }

    /**
     * Retires both roles.
     */
    public synchronized void retireAll() {
        for (ChannelRole role : ChannelRole.values()) {
            retire(role);
        }
    }

    /**
     * Changes the address used by the next {@link #setup(ChannelRole)}.
     *
     * @param role    The role to update.
     * @param address The new address; blank disables automatic setup.
     */
    public synchronized void setAddress(ChannelRole role, String address) {
        connections.get(role).setAddress(address);
    }

    public String getAddress(ChannelRole role) {
        return connections.get(role).getAddress();
    }

    /**
     * Returns the live transport of a role, if any.
     *
     * @param role The role.
     * @return The current connection, or empty when the role is down.
     */
    public Optional<FrameConnection> current(ChannelRole role) {
        return Optional.ofNullable(connections.get(role).getConnection());
    }

    public boolean isUp(ChannelRole role) {
        return connections.get(role).isUp();
    }

    public ManagedConnection get(ChannelRole role) {
        return connections.get(role);
    }

    private void install(ManagedConnection managed, FrameConnection connection) {
        ChannelRole role = managed.getRole();
        CancellationScope scope = root.newChild(role.label());
        managed.install(connection, scope);

        for (Runnable loop : loops.create(role, connection, scope, managed.getTracker())) {
            managed.getTracker().begin();
            try {
                executor.execute(loop);
            } catch (RejectedExecutionException e) {
                managed.getTracker().done();
                scope.cancel();
                throw new RelayException("Executor rejected " + role.label() + " loop", e);
            }
        }
    }

    private void awaitDrain(ManagedConnection managed) {
        try {
            while (!managed.getTracker().awaitIdle(drainWarnInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Still waiting for {} {} loop(s) to exit", managed.getTracker().getActive(),
                        managed.getRole().label());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Interrupted while retiring " + managed.getRole().label() + " connection", e);
        }
    }
}
