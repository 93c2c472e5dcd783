package io.cinerelay.tracker;

import io.cinerelay.domain.TransferStats;

import java.util.Set;

/**
 * Dedupe ledger and aggregate counters.
 * Job outcomes are recorded by the scheduler thread; enqueue callers check and count duplicates.
 */
public interface Tracker {

    /**
     * Whether the source completed successfully at least once.
     */
    boolean isProcessed(String sourceId);

    /**
     * Check if an enqueue should be refused because the source was already delivered.
     */
    default boolean shouldSkip(String sourceId, boolean allowRepost) {
        return !allowRepost && isProcessed(sourceId);
    }

    void recordStarted();

    /**
     * Add the source to the ledger (a set, so reposts do not duplicate it) and count the bytes.
     */
    void recordSuccess(String sourceId, long bytes);

    /**
     * Count a failed job. Cancelled jobs are never recorded here.
     */
    void recordFailure();

    void recordDuplicateSkipped();

    Set<String> processedSources();

    TransferStats stats();

    /**
     * Load persisted state. Missing or corrupt data starts empty.
     */
    void load();

    /**
     * Best-effort persist; failures are logged.
     */
    void save();
}
