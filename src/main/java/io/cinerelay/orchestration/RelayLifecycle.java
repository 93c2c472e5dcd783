package io.cinerelay.orchestration;

import io.cinerelay.progress.LoggingJobListener;
import io.cinerelay.staging.StagingStore;
import io.cinerelay.tracker.Tracker;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Startup and shutdown hooks of the relay.
 */
@ApplicationScoped
public class RelayLifecycle {

    private static final Logger LOG = Logger.getLogger(RelayLifecycle.class);

    private final StagingStore stagingStore;
    private final Tracker tracker;
    private final JobScheduler scheduler;
    private final LoggingJobListener loggingListener;

    @Inject
    public RelayLifecycle(StagingStore stagingStore, Tracker tracker, JobScheduler scheduler,
                          LoggingJobListener loggingListener) {
        this.stagingStore = stagingStore;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.loggingListener = loggingListener;
    }

    void onStart(@Observes StartupEvent event) {
        stagingStore.purge();
        tracker.load();
        scheduler.addListener(loggingListener);
        LOG.infof("Relay ready: %d sources already processed, staging in %s",
                tracker.processedSources().size(), stagingStore.baseDir());
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Relay shutting down");
        scheduler.shutdown();
        tracker.save();
    }
}
