package io.cinerelay.domain;

import io.cinerelay.error.ErrorKind;

import java.time.Instant;

/**
 * One source-to-sink transfer request.
 * Lifecycle fields are mutated by the scheduler thread only; {@link #flags()} is shared with the operator layer.
 */
public class Job {

    private final String id;
    private final SourceDescriptor source;
    private final DestinationMetadata destination;
    private final Instant addedAt;
    private final ControlFlags flags = new ControlFlags();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant finishedAt;
    private volatile String error;
    private volatile ErrorKind errorKind;
    private volatile String externalId;
    private volatile long bytesTransferred;

    public Job(String id, SourceDescriptor source, DestinationMetadata destination, Instant addedAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (source == null || destination == null) {
            throw new IllegalArgumentException("source and destination are required");
        }
        this.id = id;
        this.source = source;
        this.destination = destination;
        this.addedAt = addedAt != null ? addedAt : Instant.now();
    }

    public String id() {
        return id;
    }

    public SourceDescriptor source() {
        return source;
    }

    public DestinationMetadata destination() {
        return destination;
    }

    public Instant addedAt() {
        return addedAt;
    }

    public ControlFlags flags() {
        return flags;
    }

    public JobStatus status() {
        return status;
    }

    public String error() {
        return error;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String externalId() {
        return externalId;
    }

    public long bytesTransferred() {
        return bytesTransferred;
    }

    /**
     * Eligible for scheduling: still pending and not cancelled. Pause is only meaningful once processing.
     */
    public boolean isEligible() {
        return status == JobStatus.PENDING && !flags.isCancelled();
    }

    public void markProcessing() {
        transition(JobStatus.PENDING, JobStatus.PROCESSING);
    }

    public void complete(TransferResult result) {
        transition(JobStatus.PROCESSING, JobStatus.COMPLETED);
        this.externalId = result.externalId();
        this.bytesTransferred = result.bytesTransferred();
    }

    public void fail(ErrorKind kind, String message) {
        transition(JobStatus.PROCESSING, JobStatus.FAILED);
        this.errorKind = kind;
        this.error = message;
    }

    /**
     * Valid from pending (removed before it ran) or processing (stage unwound on the flag).
     */
    public void markCancelled() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " already " + status);
        }
        this.errorKind = ErrorKind.CANCELLED;
        this.status = JobStatus.CANCELLED;
        this.finishedAt = Instant.now();
    }

    public JobSnapshot snapshot() {
        return new JobSnapshot(
                id,
                source.sourceId(),
                destination.title(),
                source.sizeLabel(),
                source.provider(),
                status,
                flags.isPaused(),
                flags.isCancelled(),
                addedAt,
                finishedAt,
                error,
                errorKind,
                externalId,
                bytesTransferred
        );
    }

    private void transition(JobStatus expected, JobStatus next) {
        if (status != expected) {
            throw new IllegalStateException("Job " + id + " is " + status + ", expected " + expected);
        }
        if (next.isTerminal()) {
            this.finishedAt = Instant.now();
        }
        this.status = next;
    }
}
