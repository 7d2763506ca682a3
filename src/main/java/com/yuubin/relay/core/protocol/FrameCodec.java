package com.yuubin.relay.core.protocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import com.yuubin.relay.core.exceptions.ProtocolException;
import com.yuubin.relay.core.utils.IoUtils;

/**
 * Encodes and decodes the tag-length-value framing shared by the plugin and
 * tunnel channels.
 * <p>
 * Wire layout: one tag byte, a four byte big-endian unsigned length, then
 * exactly that many payload bytes. The codec does not interpret tags; an
 * unrecognized tag is returned like any other frame and the caller decides
 * whether it is acceptable.
 * </p>
 */
public class FrameCodec {

    /** Tag byte plus length field. */
    public static final int HEADER_LENGTH = 5;

    /** Default upper bound for a single payload. */
    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    private final int maxPayloadLength;

    public FrameCodec() {
        this(DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    /**
     * Creates a codec that rejects payloads above the given length.
     * 
     * @param maxPayloadLength Largest payload accepted in either direction.
     */
    public FrameCodec(int maxPayloadLength) {
        if (maxPayloadLength < 0) {
            throw new IllegalArgumentException("maxPayloadLength must not be negative");
        }
        this.maxPayloadLength = maxPayloadLength;
    }

    /**
     * Encodes a frame into a single buffer.
     * 
     * @param tag     The unsigned tag byte.
     * @param payload The payload, or null for a zero-length frame.
     * @return The encoded frame.
     */
    public byte[] encode(int tag, byte[] payload) {
        if (tag < 0 || tag > 0xFF) {
            throw new IllegalArgumentException("Frame tag out of range: " + tag);
        }
        byte[] body = payload == null ? IoUtils.EMPTY_BYTES : payload;
        if (body.length > maxPayloadLength) {
            throw new ProtocolException("Payload of " + body.length + " bytes exceeds limit of " + maxPayloadLength);
        }
        return ByteBuffer.allocate(HEADER_LENGTH + body.length)
                .put((byte) tag)
                .putInt(body.length)
                .put(body)
                .array();
    }

    /**
     * Writes a whole frame with one write call and flushes the stream.
     * 
     * @param out     The destination stream.
     * @param tag     The unsigned tag byte.
     * @param payload The payload, or null for a zero-length frame.
     * @throws IOException If the stream fails.
     */
    public void write(OutputStream out, int tag, byte[] payload) throws IOException {
        out.write(encode(tag, payload));
        out.flush();
    }

    /**
     * Reads exactly one frame.
     * 
     * @param in The source stream.
     * @return The decoded frame.
     * @throws EOFException      If the stream ends before a tag byte.
     * @throws ProtocolException If the stream ends mid-frame or the length is
     *                           out of range.
     * @throws IOException       If the stream fails.
     */
    public Frame read(InputStream in) throws IOException {
        int tag = in.read();
        if (tag < 0) {
            throw new EOFException("Channel closed before frame tag");
        }
        return readBody(tag, in);
    }

    /**
     * Reads the length and payload of a frame whose tag was already consumed.
     * 
     * @param tag The tag byte that started this frame.
     * @param in  The source stream, positioned at the length field.
     * @return The decoded frame.
     * @throws ProtocolException If the stream ends mid-frame or the length is
     *                           out of range.
     * @throws IOException       If the stream fails.
     */
    public Frame readBody(int tag, InputStream in) throws IOException {
        byte[] lengthField = new byte[HEADER_LENGTH - 1];
        IoUtils.readFully(in, lengthField, "length");

        long length = ByteBuffer.wrap(lengthField).getInt() & 0xFFFFFFFFL;
        if (length > maxPayloadLength) {
            throw new ProtocolException("Declared frame length " + length + " exceeds limit of " + maxPayloadLength);
        }

        byte[] payload = new byte[(int) length];
        IoUtils.readFully(in, payload, "payload");
        return new Frame(tag, payload);
    }

    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }
}
