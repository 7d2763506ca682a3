package com.yuubin.relay.core.connection;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

import com.yuubin.relay.core.concurrent.CancellationScope;

/**
 * Finishes a frame on a socket stream that has a short read timeout.
 * <p>
 * A timeout in the middle of a frame is retried for as long as the owning
 * scope is alive, so bytes already consumed are never lost. Once the scope is
 * cancelled the next timeout surfaces as {@link InterruptedIOException}.
 * </p>
 */
final class DeadlineInputStream extends FilterInputStream {

    private final CancellationScope scope;

    DeadlineInputStream(InputStream in, CancellationScope scope) {
        super(in);
        this.scope = scope;
    }

    @Override
    public int read() throws IOException {
        while (true) {
            try {
                return super.read();
            } catch (SocketTimeoutException e) {
                checkCancelled();
            }
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        while (true) {
            try {
                return super.read(b, off, len);
            } catch (SocketTimeoutException e) {
                checkCancelled();
            }
        }
    }

    private void checkCancelled() throws InterruptedIOException {
        if (scope.isCancelled()) {
            throw new InterruptedIOException("Read cancelled mid-frame (" + scope.getName() + ")");
        }
    }
}
