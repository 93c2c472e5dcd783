package io.cinerelay.domain;

import io.cinerelay.error.TransferCancelledException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pause and cancel flags of a single job.
 * Written by the operator layer at any time, polled by the pipeline at every suspension point.
 * Setting either flag wakes a pending pause-wait immediately.
 */
public final class ControlFlags {

    private static final Logger LOG = Logger.getLogger(ControlFlags.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final List<Runnable> cancelHooks = new ArrayList<>();

    private volatile boolean paused;
    private volatile boolean cancelled;

    public boolean isPaused() {
        return paused;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setPaused(boolean value) {
        lock.lock();
        try {
            paused = value;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark cancelled and run the registered cancel hooks once.
     */
    public void cancel() {
        List<Runnable> hooks;
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            cancelled = true;
            changed.signalAll();
            hooks = new ArrayList<>(cancelHooks);
            cancelHooks.clear();
        } finally {
            lock.unlock();
        }
        hooks.forEach(ControlFlags::runHook);
    }

    /**
     * Register an action that aborts a blocked I/O call when the job is cancelled.
     * Runs immediately if the job is already cancelled.
     */
    public Registration onCancel(Runnable hook) {
        lock.lock();
        try {
            if (!cancelled) {
                cancelHooks.add(hook);
                return () -> {
                    lock.lock();
                    try {
                        cancelHooks.remove(hook);
                    } finally {
                        lock.unlock();
                    }
                };
            }
        } finally {
            lock.unlock();
        }
        runHook(hook);
        return () -> {
        };
    }

    public void throwIfCancelled() throws TransferCancelledException {
        if (cancelled) {
            throw new TransferCancelledException();
        }
    }

    /**
     * Suspension point: fails fast when cancelled, otherwise blocks while paused.
     * The wait re-checks every {@code pollIntervalMs} and returns early on resume or cancel.
     *
     * @param whilePaused invoked once per poll while the job stays paused
     */
    public void checkpoint(long pollIntervalMs, Runnable whilePaused) throws TransferCancelledException {
        throwIfCancelled();
        while (paused) {
            whilePaused.run();
            lock.lock();
            try {
                if (paused && !cancelled) {
                    changed.await(pollIntervalMs, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransferCancelledException();
            } finally {
                lock.unlock();
            }
            throwIfCancelled();
        }
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Cancel hook failed");
        }
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
