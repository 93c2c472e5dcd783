package io.cinerelay.progress;

import java.time.Duration;

/**
 * A sample the throttler decided to emit, with derived display data.
 * Speed and ETA are informational only.
 */
public record ProgressUpdate(
        int percent,
        long bytesMoved,
        long totalBytes,
        double bytesPerSecond,
        Duration eta
) {
}
