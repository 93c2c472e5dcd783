package io.cinerelay.source;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * An open payload stream plus its declared length.
 * Closing it from another thread aborts a blocked read.
 */
public final class SourceConnection implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SourceConnection.class);

    private final InputStream body;
    private final long contentLength;

    /**
     * @param contentLength declared length, or -1 when the source does not report one
     */
    public SourceConnection(InputStream body, long contentLength) {
        this.body = body;
        this.contentLength = contentLength;
    }

    public InputStream body() {
        return body;
    }

    public long contentLength() {
        return contentLength;
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            LOG.debugf(e, "Failed to close source stream");
        }
    }
}
