package io.cinerelay.sink;

import java.io.IOException;
import java.io.InputStream;

/**
 * A staged payload as seen by a sink: fixed size, read in bounded chunks.
 * Chunk streams honour the job's pause/cancel flags and report progress as they are read;
 * a cancelled job makes them throw {@link java.io.InterruptedIOException}.
 */
public interface UploadSource {

    long size();

    int chunkSize();

    InputStream openChunk(long offset, int length) throws IOException;
}
