package io.cinerelay.staging;

import io.cinerelay.error.StagingIOException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Handle on one job's staging file. Closing it removes the file.
 */
public final class StagedFile implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(StagedFile.class);

    private final StagingStore store;
    private final Path path;
    private OutputStream out;
    private long size;

    StagedFile(StagingStore store, Path path, OutputStream out) {
        this.store = store;
        this.path = path;
        this.out = out;
    }

    public Path path() {
        return path;
    }

    public long size() {
        return size;
    }

    public void append(byte[] bytes, int offset, int length) throws StagingIOException {
        if (out == null) {
            throw new IllegalStateException("Staging file already finalized: " + path);
        }
        try {
            out.write(bytes, offset, length);
            size += length;
        } catch (IOException e) {
            throw new StagingIOException("Failed to write staging file " + path, e);
        }
    }

    /**
     * Flush and close the writer; the file stays until {@link #close()}.
     */
    public Path finish() throws StagingIOException {
        if (out != null) {
            try {
                out.close();
            } catch (IOException e) {
                throw new StagingIOException("Failed to finalize staging file " + path, e);
            } finally {
                out = null;
            }
        }
        return path;
    }

    @Override
    public void close() {
        if (out != null) {
            try {
                out.close();
            } catch (IOException e) {
                LOG.debugf(e, "Failed to close writer for %s", path);
            }
            out = null;
        }
        store.remove(path);
    }
}
