package io.cinerelay.progress;

import io.cinerelay.domain.JobSnapshot;
import io.cinerelay.util.ProgressFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default notification channel: status lines in the application log.
 */
@ApplicationScoped
public class LoggingJobListener implements JobListener {

    private static final Logger LOG = Logger.getLogger(LoggingJobListener.class);

    @Override
    public void onStarted(JobSnapshot job) {
        LOG.infof("Starting job %s: %s (%s, source %s)", job.jobId(), job.title(), job.sizeLabel(), job.provider());
    }

    @Override
    public void onProgress(ProgressEvent event) {
        if (event.paused()) {
            LOG.infof("Job %s %s paused at %d%%", event.jobId(), event.stage(), event.percent());
            return;
        }
        LOG.infof("Job %s %s %s %d%% | %s of %s | %s | ETA %s",
                event.jobId(),
                event.stage(),
                ProgressFormat.bar(event.percent()),
                event.percent(),
                ProgressFormat.bytes(event.bytesMoved()),
                ProgressFormat.bytes(event.totalBytes()),
                ProgressFormat.speed(event.bytesPerSecond()),
                ProgressFormat.eta(event.eta()));
    }

    @Override
    public void onFinished(JobSnapshot job) {
        switch (job.status()) {
            case COMPLETED -> LOG.infof("Job %s posted successfully: %s -> %s (%s)",
                    job.jobId(), job.title(), job.externalId(), ProgressFormat.bytes(job.bytesTransferred()));
            case CANCELLED -> LOG.infof("Job %s cancelled: %s", job.jobId(), job.title());
            default -> LOG.errorf("Job %s failed [%s]: %s", job.jobId(), job.errorKind(), job.error());
        }
    }
}
