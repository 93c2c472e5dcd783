package io.cinerelay.progress;

import io.cinerelay.domain.Stage;

import java.time.Duration;

/**
 * Throttled progress notification for the operator layer.
 */
public record ProgressEvent(
        String jobId,
        Stage stage,
        int percent,
        long bytesMoved,
        long totalBytes,
        double bytesPerSecond,
        Duration eta,
        boolean paused
) {
    public static ProgressEvent of(String jobId, Stage stage, ProgressUpdate update) {
        return new ProgressEvent(jobId, stage, update.percent(), update.bytesMoved(), update.totalBytes(),
                update.bytesPerSecond(), update.eta(), false);
    }

    public static ProgressEvent paused(String jobId, Stage stage, int percent) {
        return new ProgressEvent(jobId, stage, percent, 0, 0, 0.0, Duration.ZERO, true);
    }
}
