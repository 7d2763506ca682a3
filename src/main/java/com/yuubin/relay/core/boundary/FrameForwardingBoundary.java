package com.yuubin.relay.core.boundary;

import java.io.IOException;

import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.ConnectionManager;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.PluginFrameType;
import com.yuubin.relay.core.constants.TunnelFrameType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Default {@link PluginBoundary}: pushed tasks go out on the tunnel as task
 * frames, task results go back to the plugin as task-result frames.
 */
public class FrameForwardingBoundary implements PluginBoundary {

    private final ConnectionManager connections;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public FrameForwardingBoundary(ConnectionManager connections) {
        this.connections = connections;
    }

    @Override
    public void onPushTask(byte[] task) throws IOException {
        require(ChannelRole.TUNNEL).send(TunnelFrameType.TASK.getCode(), task);
    }

    @Override
    public void onTaskResult(byte[] result) throws IOException {
        require(ChannelRole.PLUGIN).send(PluginFrameType.TASK_RESULT.getCode(), result);
    }

    private FrameConnection require(ChannelRole role) throws IOException {
        return connections.current(role)
                .orElseThrow(() -> new IOException(role.label() + " connection is down"));
    }
}
