package io.cinerelay.progress;

import io.cinerelay.domain.JobSnapshot;

import java.util.function.Consumer;

/**
 * Outbound notifications for a job. Implementations may drop updates (rate-limited channels);
 * exceptions thrown here are logged and never fail the job.
 */
public interface JobListener {

    default void onStarted(JobSnapshot job) {
    }

    default void onProgress(ProgressEvent event) {
    }

    /**
     * Exactly one call per job, once it reached a terminal state.
     */
    default void onFinished(JobSnapshot job) {
    }

    /**
     * Progress stream of a single job.
     */
    static JobListener forJob(String jobId, Consumer<ProgressEvent> consumer) {
        return new JobListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                if (event.jobId().equals(jobId)) {
                    consumer.accept(event);
                }
            }
        };
    }
}
