package io.cinerelay.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Utility for generating job identifiers.
 * Ids are derived from the wall clock in milliseconds and never repeat within a process,
 * even when two jobs are enqueued in the same millisecond.
 */
public final class JobIdentity {

    private static final AtomicLong LAST = new AtomicLong();

    private JobIdentity() {
        // Utility class
    }

    public static String nextId() {
        return nextId(System.currentTimeMillis());
    }

    static String nextId(long nowMillis) {
        long id = LAST.updateAndGet(prev -> Math.max(prev + 1, nowMillis));
        return Long.toString(id);
    }
}
