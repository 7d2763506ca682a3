package com.yuubin.relay.core.constants;

import java.util.Optional;

/**
 * Frame tags understood on the plugin channel.
 */
public enum PluginFrameType {
    /** Work item supplied by the plugin; carries the task payload. */
    PUSH_TASK(0x01),
    /** Task result forwarded from the tunnel to the plugin. */
    TASK_RESULT(0x02),
    /** Zero-length notice that the tunnel could not be re-established. */
    TUNNEL_RECONNECT_FAILED(0x03);

    private final int code;

    PluginFrameType(int code) {
        this.code = code;
    }

    /**
     * Retrieves the wire tag of this frame type.
     * 
     * @return The one-byte tag value.
     */
    public int getCode() {
        return code;
    }

    /**
     * Looks up the frame type for a wire tag.
     * 
     * @param code The tag read from the wire.
     * @return The matching type, or empty if the tag is not a plugin tag.
     */
    public static Optional<PluginFrameType> fromCode(int code) {
        for (PluginFrameType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
