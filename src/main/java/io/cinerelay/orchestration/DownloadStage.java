package io.cinerelay.orchestration;

import io.cinerelay.domain.ControlFlags;
import io.cinerelay.error.TransferException;
import io.cinerelay.error.TransferNetworkException;
import io.cinerelay.error.TransferTimeoutException;
import io.cinerelay.error.TransferTooLargeException;
import io.cinerelay.progress.ProgressReporter;
import io.cinerelay.progress.TransferProgress;
import io.cinerelay.source.SourceConnection;
import io.cinerelay.source.SourceProvider;
import io.cinerelay.staging.StagedFile;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Streams a remote payload into a staging file.
 * <p>
 * Every received chunk is written, reported, then passed through the job's suspension point
 * (pause wait, cancel check). A cancel that arrives while a read is blocked closes the connection.
 * The overall deadline is enforced by a watchdog that closes the connection as well.
 */
@ApplicationScoped
public class DownloadStage {

    private static final Logger LOG = Logger.getLogger(DownloadStage.class);

    private final List<SourceProvider> providers;
    private final long maxBytes;
    private final long timeoutMs;
    private final int bufferSize;
    private final long pollIntervalMs;
    private final ScheduledExecutorService watchdog;

    @Inject
    public DownloadStage(
            @Any Instance<SourceProvider> providers,
            @ConfigProperty(name = "relay.download.max-bytes", defaultValue = "4294967296") long maxBytes,
            @ConfigProperty(name = "relay.download.timeout-ms", defaultValue = "1800000") long timeoutMs,
            @ConfigProperty(name = "relay.download.buffer-size", defaultValue = "65536") int bufferSize,
            @ConfigProperty(name = "relay.control.poll-interval-ms", defaultValue = "2000") long pollIntervalMs
    ) {
        this(providers.stream().collect(Collectors.toList()), maxBytes, timeoutMs, bufferSize, pollIntervalMs);
    }

    public DownloadStage(List<SourceProvider> providers, long maxBytes, long timeoutMs,
                         int bufferSize, long pollIntervalMs) {
        this.providers = List.copyOf(providers);
        this.maxBytes = maxBytes;
        this.timeoutMs = timeoutMs;
        this.bufferSize = bufferSize;
        this.pollIntervalMs = pollIntervalMs;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-download-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return number of bytes written to {@code target}
     */
    public long download(URI sourceUrl, StagedFile target, ControlFlags flags, ProgressReporter reporter)
            throws TransferException {
        flags.throwIfCancelled();
        SourceProvider provider = resolve(sourceUrl);

        long startedAt = System.currentTimeMillis();
        SourceConnection connection = provider.open(sourceUrl, Duration.ofMillis(timeoutMs));

        AtomicBoolean timedOut = new AtomicBoolean();
        long remainingMs = Math.max(0, timeoutMs - (System.currentTimeMillis() - startedAt));
        ScheduledFuture<?> deadline = watchdog.schedule(() -> {
            timedOut.set(true);
            connection.close();
        }, remainingMs, TimeUnit.MILLISECONDS);

        try (connection; ControlFlags.Registration abort = flags.onCancel(connection::close)) {
            long total = connection.contentLength();
            if (total > maxBytes) {
                throw new TransferTooLargeException(maxBytes, total);
            }
            long written = copy(connection.body(), total, target, flags, reporter, timedOut);
            LOG.debugf("Downloaded %d bytes from %s", written, sourceUrl.getHost());
            return written;
        } finally {
            deadline.cancel(false);
        }
    }

    private long copy(InputStream in, long total, StagedFile target, ControlFlags flags,
                      ProgressReporter reporter, AtomicBoolean timedOut) throws TransferException {
        byte[] buffer = new byte[bufferSize];
        long written = 0;

        while (true) {
            int n;
            try {
                n = in.read(buffer);
            } catch (IOException e) {
                flags.throwIfCancelled();
                if (timedOut.get()) {
                    throw new TransferTimeoutException("Download exceeded " + timeoutMs + " ms", e);
                }
                throw new TransferNetworkException("Download failed: " + e.getMessage(), e);
            }
            if (n == -1) {
                break;
            }

            written += n;
            if (written > maxBytes) {
                throw new TransferTooLargeException(maxBytes, written);
            }
            target.append(buffer, 0, n);
            reporter.report(new TransferProgress(written, total, System.currentTimeMillis()));
            flags.checkpoint(pollIntervalMs, reporter::paused);
        }

        flags.throwIfCancelled();
        if (timedOut.get()) {
            throw new TransferTimeoutException("Download exceeded " + timeoutMs + " ms");
        }
        if (total > 0 && written < total) {
            throw new TransferNetworkException("Connection closed after " + written + " of " + total + " bytes");
        }
        // undeclared or empty payloads only learn their size here
        reporter.report(new TransferProgress(written, written, System.currentTimeMillis()));
        return written;
    }

    private SourceProvider resolve(URI url) throws TransferNetworkException {
        return providers.stream()
                .filter(p -> p.supports(url))
                .findFirst()
                .orElseThrow(() -> new TransferNetworkException("Unsupported source URL: " + url));
    }

    @PreDestroy
    void shutdown() {
        watchdog.shutdownNow();
    }
}
