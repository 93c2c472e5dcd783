package io.cinerelay.domain;

import java.time.Instant;

/**
 * Aggregate counters kept next to the dedupe ledger.
 */
public record TransferStats(
        long totalJobs,
        long successCount,
        long failureCount,
        long duplicatesSkipped,
        long totalBytes,
        int processedSources,
        Instant startTime,
        Instant lastSaved
) {
    public double successRate() {
        return totalJobs > 0 ? (successCount * 100.0) / totalJobs : 0.0;
    }
}
