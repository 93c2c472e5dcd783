package io.cinerelay.orchestration;

import io.cinerelay.domain.ControlFlags;
import io.cinerelay.error.TransferCancelledException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.function.LongConsumer;

/**
 * Bounded view of a stream that passes every read through the job's suspension point
 * and reports the absolute position reached.
 */
final class ControlledInputStream extends FilterInputStream {

    private final ControlFlags flags;
    private final long pollIntervalMs;
    private final Runnable whilePaused;
    private final LongConsumer onPosition;

    private long position;
    private long remaining;

    ControlledInputStream(InputStream in, long startPosition, long limit,
                          ControlFlags flags, long pollIntervalMs,
                          Runnable whilePaused, LongConsumer onPosition) {
        super(in);
        this.position = startPosition;
        this.remaining = limit;
        this.flags = flags;
        this.pollIntervalMs = pollIntervalMs;
        this.whilePaused = whilePaused;
        this.onPosition = onPosition;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n == -1 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (remaining <= 0) {
            return -1;
        }
        try {
            flags.checkpoint(pollIntervalMs, whilePaused);
        } catch (TransferCancelledException e) {
            throw new InterruptedIOException(e.getMessage());
        }
        int n = super.read(b, off, (int) Math.min(len, remaining));
        if (n > 0) {
            remaining -= n;
            position += n;
            onPosition.accept(position);
        }
        return n;
    }

    @Override
    public long skip(long n) {
        return 0;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(super.available(), remaining);
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
