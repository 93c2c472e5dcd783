package io.cinerelay.orchestration;

import io.cinerelay.domain.ControlFlags;
import io.cinerelay.domain.Job;
import io.cinerelay.domain.Stage;
import io.cinerelay.domain.TransferResult;
import io.cinerelay.error.TransferException;
import io.cinerelay.progress.JobListener;
import io.cinerelay.progress.ProgressEvent;
import io.cinerelay.progress.ProgressReporter;
import io.cinerelay.progress.ProgressThrottler;
import io.cinerelay.progress.TransferProgress;
import io.cinerelay.staging.StagedFile;
import io.cinerelay.staging.StagingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Runs one job's pipeline: stage the download, then upload the staged file.
 * Handles the flow: create staging file → download → finalize → upload → remove staging file.
 * The staging file is removed on every exit path.
 */
@ApplicationScoped
public class TransferOrchestrator {

    private static final Logger LOG = Logger.getLogger(TransferOrchestrator.class);

    /** Leading share of the upload percentage reserved for preparing the upload. */
    static final int UPLOAD_BASE_PERCENT = 5;

    private final StagingStore stagingStore;
    private final DownloadStage downloadStage;
    private final UploadStage uploadStage;
    private final long minIntervalMs;
    private final long maxIntervalMs;

    @Inject
    public TransferOrchestrator(
            StagingStore stagingStore,
            DownloadStage downloadStage,
            UploadStage uploadStage,
            @ConfigProperty(name = "relay.throttle.min-interval-ms", defaultValue = "3000") long minIntervalMs,
            @ConfigProperty(name = "relay.throttle.max-interval-ms", defaultValue = "10000") long maxIntervalMs
    ) {
        this.stagingStore = stagingStore;
        this.downloadStage = downloadStage;
        this.uploadStage = uploadStage;
        this.minIntervalMs = minIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
    }

    public TransferResult execute(Job job, JobListener listener) throws TransferException {
        ControlFlags flags = job.flags();

        try (StagedFile staged = stagingStore.create(job.id())) {
            LOG.debugf("Job %s downloading %s", job.id(), job.source().url().getHost());
            long bytes = downloadStage.download(job.source().url(), staged, flags,
                    new ThrottledReporter(job.id(), Stage.DOWNLOAD, 0, listener));
            Path file = staged.finish();

            flags.throwIfCancelled();

            LOG.debugf("Job %s uploading %d bytes", job.id(), bytes);
            String externalId = uploadStage.upload(file, job.destination(), flags,
                    new ThrottledReporter(job.id(), Stage.UPLOAD, UPLOAD_BASE_PERCENT, listener));

            return new TransferResult(job.id(), job.source().sourceId(), externalId, bytes);
        }
    }

    /**
     * Feeds raw samples of one stage through a {@link ProgressThrottler} and forwards what it emits.
     */
    private final class ThrottledReporter implements ProgressReporter {

        private final String jobId;
        private final Stage stage;
        private final JobListener listener;
        private final int basePercent;
        private final ProgressThrottler throttler;

        ThrottledReporter(String jobId, Stage stage, int basePercent, JobListener listener) {
            this.jobId = jobId;
            this.stage = stage;
            this.basePercent = basePercent;
            this.listener = listener;
            this.throttler = new ProgressThrottler(System.currentTimeMillis(), minIntervalMs, maxIntervalMs, basePercent);
        }

        @Override
        public synchronized void report(TransferProgress sample) {
            throttler.observe(sample)
                    .ifPresent(update -> listener.onProgress(ProgressEvent.of(jobId, stage, update)));
        }

        @Override
        public synchronized void paused() {
            int percent = Math.max(throttler.lastEmittedPercent(), basePercent);
            listener.onProgress(ProgressEvent.paused(jobId, stage, percent));
        }
    }
}
