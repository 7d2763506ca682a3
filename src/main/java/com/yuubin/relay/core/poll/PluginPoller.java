package com.yuubin.relay.core.poll;

import java.time.Duration;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.concurrent.CompletionTracker;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.connection.FrameConnection;
import com.yuubin.relay.core.constants.PluginFrameType;
import com.yuubin.relay.core.exceptions.ProtocolException;
import com.yuubin.relay.core.protocol.Frame;
import com.yuubin.relay.core.request.DispatchInbox;
import com.yuubin.relay.core.request.Request;
import com.yuubin.relay.core.request.RequestType;

/**
 * Read loop for the plugin channel. The plugin only ever sends push-task
 * frames; any other tag is a protocol fault.
 */
public class PluginPoller extends AbstractPoller {

    public PluginPoller(FrameConnection connection, CancellationScope scope, CompletionTracker tracker,
            DispatchInbox inbox, Duration readTimeout) {
        super(ChannelRole.PLUGIN, connection, scope, tracker, inbox, readTimeout);
    }

    @Override
    protected Request toRequest(Frame frame) {
        PluginFrameType type = PluginFrameType.fromCode(frame.tag())
                .orElseThrow(() -> new ProtocolException("Unknown plugin frame tag 0x" + Integer.toHexString(frame.tag())));
        if (type != PluginFrameType.PUSH_TASK) {
            throw new ProtocolException("Plugin may not send " + type + " frames");
        }
        return new Request(RequestType.PUSH_TASK, frame.payload());
    }
}
