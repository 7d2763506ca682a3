package com.yuubin.relay.core.protocol;

import java.util.Arrays;

import com.yuubin.relay.core.utils.IoUtils;

/**
 * One tag-length-value unit as read from or written to a relay channel.
 * <p>
 * The tag is kept as a raw unsigned byte: whether it means anything depends on
 * the channel the frame arrived on.
 * </p>
 *
 * @param tag     Unsigned tag byte (0-255).
 * @param payload Frame payload, never null.
 */
public record Frame(int tag, byte[] payload) {

    public Frame {
        if (tag < 0 || tag > 0xFF) {
            throw new IllegalArgumentException("Frame tag out of range: " + tag);
        }
        payload = payload == null ? IoUtils.EMPTY_BYTES : payload.clone();
    }

    /**
     * Creates a zero-length frame.
     * 
     * @param tag The frame tag.
     * @return A frame with an empty payload.
     */
    public static Frame empty(int tag) {
        return new Frame(tag, IoUtils.EMPTY_BYTES);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Retrieves the declared length of the payload.
     * 
     * @return Payload length in bytes.
     */
    public int length() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return tag == other.tag && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * tag + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[tag=0x" + Integer.toHexString(tag) + ", length=" + payload.length + "]";
    }
}
