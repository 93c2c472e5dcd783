package io.cinerelay.progress;

/**
 * Receives the raw samples of one stage run.
 */
public interface ProgressReporter {

    void report(TransferProgress sample);

    /**
     * Called on every poll tick while the stage is held by a pause.
     */
    default void paused() {
    }
}
