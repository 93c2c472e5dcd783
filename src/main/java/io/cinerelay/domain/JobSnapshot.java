package io.cinerelay.domain;

import io.cinerelay.error.ErrorKind;

import java.time.Instant;

/**
 * Immutable view of a {@link Job} for the operator layer.
 */
public record JobSnapshot(
        String jobId,
        String sourceId,
        String title,
        String sizeLabel,
        String provider,
        JobStatus status,
        boolean paused,
        boolean cancelled,
        Instant addedAt,
        Instant finishedAt,
        String error,
        ErrorKind errorKind,
        String externalId,
        long bytesTransferred
) {
}
