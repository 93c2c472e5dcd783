package io.cinerelay.domain;

/**
 * Result of one successful download + upload run.
 */
public record TransferResult(
        String jobId,
        String sourceId,
        String externalId,
        long bytesTransferred
) {
}
