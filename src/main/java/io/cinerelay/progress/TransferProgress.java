package io.cinerelay.progress;

/**
 * Raw progress sample produced on every I/O callback. Never persisted.
 *
 * @param totalBytes expected total, or a non-positive value when unknown
 */
public record TransferProgress(
        long bytesMoved,
        long totalBytes,
        long timestampMs
) {
}
