package com.yuubin.relay.core.connection;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;

/**
 * Bookkeeping for one role: target address, live transport, the scope of the
 * current generation and the tracker counting its loops.
 * <p>
 * Transport and scope are only replaced by {@link ConnectionManager}; readers
 * treat them as fixed for the lifetime of their scope.
 * </p>
 */
public final class ManagedConnection {

    private final ChannelRole role;
    private final CompletionTracker tracker = new CompletionTracker();
    private volatile String address;
    private volatile FrameConnection connection;
    private volatile CancellationScope scope;

    ManagedConnection(ChannelRole role, String address) {
        this.role = role;
        this.address = normalize(address);
    }

    public ChannelRole getRole() {
        return role;
    }

    public String getAddress() {
        return address;
    }

    void setAddress(String address) {
        this.address = normalize(address);
    }

    private static String normalize(String address) {
        return address == null ? "" : address.trim();
    }

    public FrameConnection getConnection() {
        return connection;
    }

    public CancellationScope getScope() {
        return scope;
    }

    public CompletionTracker getTracker() {
        return tracker;
    }

    /**
     * Checks whether a live generation is installed.
     * 
     * @return True if a connection is attached and its scope is not cancelled.
     */
    public boolean isUp() {
        FrameConnection c = connection;
        CancellationScope s = scope;
        return c != null && !c.isClosed() && s != null && !s.isCancelled();
    }

    void install(FrameConnection newConnection, CancellationScope newScope) {
        this.connection = newConnection;
        this.scope = newScope;
    }

    void clear() {
        this.connection = null;
        this.scope = null;
    }
}
