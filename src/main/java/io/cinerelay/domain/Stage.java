package io.cinerelay.domain;

/**
 * The two I/O phases of a job's pipeline.
 */
public enum Stage {
    DOWNLOAD,
    UPLOAD
}
