package com.yuubin.relay.core.utils;

import java.io.IOException;
import java.io.InputStream;

import com.yuubin.relay.core.exceptions.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common I/O helpers for relay transports.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Shared zero-length payload. */
    public static final byte[] EMPTY_BYTES = new byte[0];

    /**
     * Fills {@code buffer} completely from the stream.
     * Running out of input part way is a framing error, not a short read.
     * 
     * @param in     The source stream.
     * @param buffer The buffer to fill.
     * @param part   Name of the field being read, for the error message.
     * @throws ProtocolException If the stream ends before the buffer is full.
     * @throws IOException       If the stream fails.
     */
    public static void readFully(InputStream in, byte[] buffer, String part) throws IOException {
        int offset = 0;
        while (offset < buffer.length) {
            int read = in.read(buffer, offset, buffer.length - offset);
            if (read < 0) {
                throw new ProtocolException("Truncated frame: expected " + buffer.length + " " + part
                        + " bytes but stream ended after " + offset);
            }
            offset += read;
        }
    }

    /**
     * Safely closes a resource without throwing exceptions.
     * 
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     * 
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
