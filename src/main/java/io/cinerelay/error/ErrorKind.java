package io.cinerelay.error;

/**
 * Classifies why a job stopped before completing.
 */
public enum ErrorKind {
    CANCELLED,
    NETWORK,
    TIMEOUT,
    TOO_LARGE,
    SINK,
    AUTH_EXPIRED,
    STAGING_IO,
    CATALOG,
    DUPLICATE,
    /** Unexpected runtime failure inside the pipeline. */
    INTERNAL
}
