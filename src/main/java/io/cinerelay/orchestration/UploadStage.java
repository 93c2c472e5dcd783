package io.cinerelay.orchestration;

import io.cinerelay.domain.ControlFlags;
import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.error.AuthExpiredException;
import io.cinerelay.error.StagingIOException;
import io.cinerelay.error.TransferCancelledException;
import io.cinerelay.error.TransferException;
import io.cinerelay.progress.ProgressReporter;
import io.cinerelay.progress.TransferProgress;
import io.cinerelay.sink.Sink;
import io.cinerelay.sink.UploadSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Hands a staged file to the {@link Sink} in bounded chunks.
 * Progress is the highest file offset read so far, so a chunk the sink re-sends never moves it backwards.
 */
@ApplicationScoped
public class UploadStage {

    private static final Logger LOG = Logger.getLogger(UploadStage.class);

    private final Sink sink;
    private final int chunkSize;
    private final long pollIntervalMs;

    @Inject
    public UploadStage(
            Sink sink,
            @ConfigProperty(name = "relay.upload.chunk-size", defaultValue = "10485760") int chunkSize,
            @ConfigProperty(name = "relay.control.poll-interval-ms", defaultValue = "2000") long pollIntervalMs
    ) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk size must be positive");
        }
        this.sink = sink;
        this.chunkSize = chunkSize;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * @return the destination's id for the uploaded item
     */
    public String upload(Path stagedFile, DestinationMetadata metadata, ControlFlags flags, ProgressReporter reporter)
            throws TransferException {
        flags.checkpoint(pollIntervalMs, reporter::paused);

        long size;
        try {
            size = Files.size(stagedFile);
        } catch (IOException e) {
            throw new StagingIOException("Cannot read staged file " + stagedFile, e);
        }

        reporter.report(new TransferProgress(0, size, System.currentTimeMillis()));
        StagedUploadSource source = new StagedUploadSource(stagedFile, size, flags, reporter);

        try {
            String externalId = sink.upload(source, metadata);
            LOG.debugf("Uploaded %s (%d bytes) as %s", stagedFile.getFileName(), size, externalId);
            return externalId;
        } catch (AuthExpiredException e) {
            throw e;
        } catch (TransferException e) {
            if (flags.isCancelled()) {
                throw new TransferCancelledException();
            }
            throw e;
        }
    }

    private final class StagedUploadSource implements UploadSource {

        private final Path path;
        private final long size;
        private final ControlFlags flags;
        private final ProgressReporter reporter;
        private long highWater;

        StagedUploadSource(Path path, long size, ControlFlags flags, ProgressReporter reporter) {
            this.path = path;
            this.size = size;
            this.flags = flags;
            this.reporter = reporter;
        }

        @Override
        public long size() {
            return size;
        }

        @Override
        public int chunkSize() {
            return chunkSize;
        }

        @Override
        public InputStream openChunk(long offset, int length) throws IOException {
            if (offset < 0 || offset + length > size) {
                throw new IllegalArgumentException("Chunk [" + offset + ", " + (offset + length) + ") outside file of " + size);
            }
            FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
            try {
                channel.position(offset);
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            return new ControlledInputStream(Channels.newInputStream(channel), offset, length,
                    flags, pollIntervalMs, reporter::paused, this::advance);
        }

        private synchronized void advance(long position) {
            if (position > highWater) {
                highWater = position;
                reporter.report(new TransferProgress(highWater, size, System.currentTimeMillis()));
            }
        }
    }
}
