package com.yuubin.relay.core.request;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of request handed to the dispatch loop.
 * <p>
 * The {@code CREATE_*} constants are declared contiguously and must stay that
 * way: {@link #CONNECTION_KINDS} is an ordinal range over them.
 * </p>
 */
public enum RequestType {
    /** Task pushed by the plugin, bound for the tunnel. */
    PUSH_TASK,
    /** Task result received from the tunnel, bound for the plugin. */
    TASK_RESULT,
    /** Synthesized when a tunnel poller attaches to a fresh connection. */
    TUNNEL_CONNECT_OK,
    /** Keepalive probe received from the tunnel peer. */
    PING,
    CREATE_SS_CONNECT,
    CREATE_SOCKS5_CONNECT,
    CREATE_DIRECT_CONNECT;

    /** Every kind that asks for a data connection. */
    public static final Set<RequestType> CONNECTION_KINDS = Collections.unmodifiableSet(
            EnumSet.range(CREATE_SS_CONNECT, CREATE_DIRECT_CONNECT));

    /**
     * Checks whether this kind requests a data connection.
     * 
     * @return True for the {@code CREATE_*} kinds.
     */
    public boolean isConnectionCreation() {
        return CONNECTION_KINDS.contains(this);
    }
}
