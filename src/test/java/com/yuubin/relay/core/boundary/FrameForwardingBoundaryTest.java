package com.yuubin.relay.core.boundary;

import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.ConnectionManager;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.PluginFrameType;
import com.yuubin.relay.core.constants.TunnelFrameType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FrameForwardingBoundaryTest {

    private ConnectionManager connections;
    private FrameForwardingBoundary boundary;

    @BeforeEach
    void setUp() {
        connections = mock(ConnectionManager.class);
        boundary = new FrameForwardingBoundary(connections);
    }

    @Test
    void pushTask_isSentToTunnelAsTaskFrame() throws Exception {
        FrameConnection tunnel = mock(FrameConnection.class);
        when(connections.current(ChannelRole.TUNNEL)).thenReturn(Optional.of(tunnel));
        byte[] task = { 1, 2, 3 };

        boundary.onPushTask(task);

        verify(tunnel).send(TunnelFrameType.TASK.getCode(), task);
    }

    @Test
    void taskResult_isSentToPluginAsResultFrame() throws Exception {
        FrameConnection plugin = mock(FrameConnection.class);
        when(connections.current(ChannelRole.PLUGIN)).thenReturn(Optional.of(plugin));
        byte[] result = { 9 };

        boundary.onTaskResult(result);

        verify(plugin).send(PluginFrameType.TASK_RESULT.getCode(), result);
    }

    @Test
    void missingTarget_failsWithIOException() {
        when(connections.current(ChannelRole.TUNNEL)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> boundary.onPushTask(new byte[0]))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("tunnel");
    }
}
