package io.cinerelay.orchestration;

import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.domain.DuplicatePolicy;
import io.cinerelay.domain.Job;
import io.cinerelay.domain.JobSnapshot;
import io.cinerelay.domain.JobStatus;
import io.cinerelay.domain.SourceDescriptor;
import io.cinerelay.domain.TransferResult;
import io.cinerelay.domain.TransferStats;
import io.cinerelay.error.DuplicateSourceException;
import io.cinerelay.error.ErrorKind;
import io.cinerelay.error.TransferCancelledException;
import io.cinerelay.error.TransferException;
import io.cinerelay.progress.JobListener;
import io.cinerelay.progress.ProgressEvent;
import io.cinerelay.tracker.Tracker;
import io.cinerelay.util.JobIdentity;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single-lane job queue.
 * <p>
 * Jobs run one at a time, in enqueue order, on a dedicated scheduler thread. The job being
 * processed occupies the active slot until it reaches a terminal state; it is then removed from
 * the queue, the slot is cleared, and the next run is scheduled after a quiescence delay.
 * <p>
 * Operator calls ({@link #enqueue}, {@link #setPaused}, {@link #cancel}, {@link #remove}) may come
 * from any thread. They touch a running job only through its {@link io.cinerelay.domain.ControlFlags}.
 */
@ApplicationScoped
public class JobScheduler {

    private static final Logger LOG = Logger.getLogger(JobScheduler.class);

    private static final int FINISHED_HISTORY = 100;

    private final TransferOrchestrator orchestrator;
    private final Tracker tracker;
    private final long quiescenceDelayMs;
    private final ScheduledExecutorService executor;

    private final Object lock = new Object();
    private final List<Job> queue = new ArrayList<>();
    private final Map<String, Job> finished = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Job> eldest) {
            return size() > FINISHED_HISTORY;
        }
    };
    private Job active;

    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final JobListener fanOut = new JobListener() {
        @Override
        public void onProgress(ProgressEvent event) {
            notifyListeners(l -> l.onProgress(event));
        }
    };

    @Inject
    public JobScheduler(
            TransferOrchestrator orchestrator,
            Tracker tracker,
            @ConfigProperty(name = "relay.scheduler.quiescence-delay-ms", defaultValue = "2000") long quiescenceDelayMs
    ) {
        this.orchestrator = orchestrator;
        this.tracker = tracker;
        this.quiescenceDelayMs = quiescenceDelayMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    /**
     * Enqueue refusing sources that already completed once.
     */
    public String enqueue(SourceDescriptor source, DestinationMetadata destination) throws DuplicateSourceException {
        return enqueue(source, destination, DuplicatePolicy.BLOCK);
    }

    /**
     * Append a job to the tail of the queue and wake the scheduler.
     *
     * @return the new job's id
     * @throws DuplicateSourceException if {@code policy} is {@link DuplicatePolicy#BLOCK} and the source already completed
     */
    public String enqueue(SourceDescriptor source, DestinationMetadata destination, DuplicatePolicy policy)
            throws DuplicateSourceException {
        if (tracker.shouldSkip(source.sourceId(), policy == DuplicatePolicy.ALLOW)) {
            tracker.recordDuplicateSkipped();
            LOG.infof("Refusing already processed source %s", source.sourceId());
            throw new DuplicateSourceException(source.sourceId());
        }

        Job job = new Job(JobIdentity.nextId(), source, destination, Instant.now());
        int position;
        synchronized (lock) {
            queue.add(job);
            position = queue.size();
        }
        LOG.infof("Queued job %s at position %d: %s (%s, source %s)%s",
                job.id(), position, destination.title(), source.sizeLabel(), source.provider(),
                policy == DuplicatePolicy.ALLOW && tracker.isProcessed(source.sourceId()) ? " [repost]" : "");
        scheduleNext();
        return job.id();
    }

    /**
     * Ask the scheduler thread to start the next eligible job. Idempotent: does nothing while a job is active.
     */
    public void scheduleNext() {
        try {
            executor.execute(this::runNext);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Scheduler stopped, not scheduling");
        }
    }

    public boolean setPaused(String jobId, boolean paused) {
        Optional<Job> job;
        synchronized (lock) {
            job = findQueued(jobId);
        }
        job.ifPresent(j -> {
            j.flags().setPaused(paused);
            LOG.infof("Job %s %s", jobId, paused ? "paused" : "resumed");
        });
        return job.isPresent();
    }

    /**
     * Cancel a job. A pending job is resolved immediately; the active job unwinds at its next suspension point.
     *
     * @return false if no queued job has that id
     */
    public boolean cancel(String jobId) {
        return cancel(jobId, "cancelled");
    }

    /**
     * Remove a job from the queue. For the active job this is a cancellation: it leaves the queue once its stage unwound.
     */
    public boolean remove(String jobId) {
        return cancel(jobId, "removed");
    }

    /**
     * Cancel whatever job is currently processing.
     */
    public boolean cancelActive() {
        Job current;
        synchronized (lock) {
            current = active;
        }
        return current != null && cancel(current.id());
    }

    private boolean cancel(String jobId, String action) {
        Job job;
        boolean resolvedNow = false;
        synchronized (lock) {
            job = findQueued(jobId).orElse(null);
            if (job == null) {
                return false;
            }
            if (job != active) {
                queue.remove(job);
                job.markCancelled();
                finished.put(job.id(), job);
                resolvedNow = true;
            }
        }
        // hooks may block on connection teardown, run them unlocked
        job.flags().cancel();
        LOG.infof("Job %s %s%s", jobId, action, resolvedNow ? "" : " while processing, waiting for stage to stop");
        if (resolvedNow) {
            JobSnapshot snapshot = job.snapshot();
            notifyListeners(l -> l.onFinished(snapshot));
        }
        return true;
    }

    public Optional<JobSnapshot> getStatus(String jobId) {
        synchronized (lock) {
            Optional<Job> job = findQueued(jobId);
            if (job.isEmpty()) {
                job = Optional.ofNullable(finished.get(jobId));
            }
            return job.map(Job::snapshot);
        }
    }

    public List<JobSnapshot> queue() {
        synchronized (lock) {
            return queue.stream().map(Job::snapshot).toList();
        }
    }

    public Optional<JobSnapshot> activeJob() {
        synchronized (lock) {
            return Optional.ofNullable(active).map(Job::snapshot);
        }
    }

    public TransferStats stats() {
        return tracker.stats();
    }

    private void runNext() {
        Job next;
        synchronized (lock) {
            if (active != null) {
                return;
            }
            next = queue.stream().filter(Job::isEligible).findFirst().orElse(null);
            if (next == null) {
                return;
            }
            next.markProcessing();
            active = next;
        }
        run(next);
    }

    private void run(Job job) {
        try {
            tracker.recordStarted();
            JobSnapshot started = job.snapshot();
            notifyListeners(l -> l.onStarted(started));

            TransferResult result = orchestrator.execute(job, fanOut);
            // the source is in the ledger before COMPLETED becomes visible
            tracker.recordSuccess(job.source().sourceId(), result.bytesTransferred());
            job.complete(result);
        } catch (TransferCancelledException e) {
            job.markCancelled();
        } catch (TransferException e) {
            resolveFailure(job, e.kind(), e.getMessage(), e);
        } catch (RuntimeException e) {
            resolveFailure(job, ErrorKind.INTERNAL, e.toString(), e);
        } finally {
            finish(job);
        }
    }

    private void resolveFailure(Job job, ErrorKind kind, String message, Exception cause) {
        if (job.flags().isCancelled()) {
            LOG.debugf("Job %s failed after cancel: %s", job.id(), message);
            job.markCancelled();
            return;
        }
        tracker.recordFailure();
        job.fail(kind, message);
        if (kind == ErrorKind.AUTH_EXPIRED) {
            LOG.errorf("Job %s needs the upload account re-authenticated: %s", job.id(), message);
        } else {
            LOG.errorf(cause, "Job %s failed [%s]: %s", job.id(), kind, message);
        }
    }

    private void finish(Job job) {
        if (job.status() == JobStatus.PROCESSING) {
            tracker.recordFailure();
            job.fail(ErrorKind.INTERNAL, "Job aborted without a result");
        }

        synchronized (lock) {
            queue.remove(job);
            active = null;
            finished.put(job.id(), job);
        }

        JobSnapshot snapshot = job.snapshot();
        notifyListeners(l -> l.onFinished(snapshot));

        try {
            executor.schedule(this::runNext, quiescenceDelayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Scheduler stopped after job %s", job.id());
        }
    }

    private Optional<Job> findQueued(String jobId) {
        return queue.stream().filter(j -> j.id().equals(jobId)).findFirst();
    }

    private void notifyListeners(Consumer<JobListener> call) {
        for (JobListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                LOG.warnf("Skipping notification, listener failed: %s", e.getMessage());
            }
        }
    }

    /**
     * Cancel the active job and stop scheduling. Waits briefly for the active stage to unwind.
     */
    @PreDestroy
    public void shutdown() {
        if (executor.isShutdown()) {
            return;
        }
        cancelActive();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Active job did not stop in time, interrupting scheduler");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
