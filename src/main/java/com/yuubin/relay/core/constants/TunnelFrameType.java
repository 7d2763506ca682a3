package com.yuubin.relay.core.constants;

import java.util.Optional;

/**
 * Frame tags understood on the tunnel channel.
 */
public enum TunnelFrameType {
    /** Task frame: pushed tasks outbound, task results inbound. */
    TASK(0x01),
    /** Zero-length keepalive probe, sent in both directions. */
    PING(0x02),
    /** Request to open a shadowsocks data connection. */
    CREATE_SS_CONNECT(0x10),
    /** Request to open a SOCKS5 data connection. */
    CREATE_SOCKS5_CONNECT(0x11),
    /** Request to open a direct data connection. */
    CREATE_DIRECT_CONNECT(0x12);

    private final int code;

    TunnelFrameType(int code) {
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
     * @return The matching type, or empty if the tag is not a tunnel tag.
     */
    public static Optional<TunnelFrameType> fromCode(int code) {
        for (TunnelFrameType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
