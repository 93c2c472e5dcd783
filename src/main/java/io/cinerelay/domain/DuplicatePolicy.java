package io.cinerelay.domain;

/**
 * What enqueue does with a source that already completed once.
 */
public enum DuplicatePolicy {
    /** Reject with {@link io.cinerelay.error.DuplicateSourceException}. */
    BLOCK,
    /** Deliberate repost. */
    ALLOW
}
