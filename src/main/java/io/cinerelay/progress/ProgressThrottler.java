package io.cinerelay.progress;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounds the rate of status updates for one job stage.
 * <p>
 * A sample is emitted when its integer percent differs from the last emitted one and at least
 * {@code minIntervalMs} passed since the last emission, or when {@code maxIntervalMs} passed
 * regardless of percent. The first sample reaching 100% is always emitted.
 * <p>
 * Percent is mapped onto {@code [basePercent, 100]} so a stage can reserve a leading range.
 * An unknown total stays at the base percent; an empty payload is complete.
 * Not thread-safe; one instance per stage run.
 */
public class ProgressThrottler {

    public static final long DEFAULT_MIN_INTERVAL_MS = 3_000;
    public static final long DEFAULT_MAX_INTERVAL_MS = 10_000;

    private final long startMs;
    private final long minIntervalMs;
    private final long maxIntervalMs;
    private final int basePercent;

    private int lastEmittedPercent = -1;
    private long lastEmitMs;

    public ProgressThrottler(long startMs, long minIntervalMs, long maxIntervalMs, int basePercent) {
        if (basePercent < 0 || basePercent >= 100) {
            throw new IllegalArgumentException("basePercent must be in [0, 100)");
        }
        if (minIntervalMs < 0 || maxIntervalMs < minIntervalMs) {
            throw new IllegalArgumentException("intervals must satisfy 0 <= min <= max");
        }
        this.startMs = startMs;
        this.minIntervalMs = minIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
        this.basePercent = basePercent;
        this.lastEmitMs = startMs;
    }

    public ProgressThrottler(long startMs, int basePercent) {
        this(startMs, DEFAULT_MIN_INTERVAL_MS, DEFAULT_MAX_INTERVAL_MS, basePercent);
    }

    public Optional<ProgressUpdate> observe(TransferProgress sample) {
        int percent = percentOf(sample);
        long sinceLastEmit = sample.timestampMs() - lastEmitMs;

        boolean percentChanged = percent != lastEmittedPercent;
        boolean finalSample = percent >= 100 && lastEmittedPercent < 100;

        if ((percentChanged && sinceLastEmit >= minIntervalMs)
                || sinceLastEmit >= maxIntervalMs
                || finalSample) {
            lastEmittedPercent = percent;
            lastEmitMs = sample.timestampMs();
            return Optional.of(toUpdate(sample, percent));
        }
        return Optional.empty();
    }

    public int lastEmittedPercent() {
        return lastEmittedPercent;
    }

    public int percentOf(TransferProgress sample) {
        if (sample.totalBytes() < 0) {
            return basePercent;
        }
        if (sample.totalBytes() == 0) {
            return 100;
        }
        long moved = Math.min(Math.max(sample.bytesMoved(), 0), sample.totalBytes());
        return basePercent + (int) ((moved * (100 - basePercent)) / sample.totalBytes());
    }

    private ProgressUpdate toUpdate(TransferProgress sample, int percent) {
        double elapsedSeconds = (sample.timestampMs() - startMs) / 1000.0;
        double speed = elapsedSeconds > 0 ? sample.bytesMoved() / elapsedSeconds : 0.0;

        Duration eta = Duration.ZERO;
        if (speed > 0 && sample.totalBytes() > 0) {
            long remaining = Math.max(0, sample.totalBytes() - sample.bytesMoved());
            eta = Duration.ofSeconds((long) (remaining / speed));
        }
        return new ProgressUpdate(percent, sample.bytesMoved(), sample.totalBytes(), speed, eta);
    }
}
