package io.cinerelay.tracker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.cinerelay.domain.TransferStats;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracker persisted as two JSON documents in the data directory:
 * {@code processed_sources.json} (the ledger) and {@code analytics.json} (the counters).
 * All access is synchronized on the instance.
 */
@ApplicationScoped
public class JsonFileTracker implements Tracker {

    private static final Logger LOG = Logger.getLogger(JsonFileTracker.class);

    static final String HISTORY_FILE = "processed_sources.json";
    static final String ANALYTICS_FILE = "analytics.json";

    private final Path dataDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final Set<String> processed = new LinkedHashSet<>();
    private long totalJobs;
    private long successCount;
    private long failureCount;
    private long duplicatesSkipped;
    private long totalBytes;
    private Instant startTime;
    private Instant lastSaved;

    @Inject
    public JsonFileTracker(
            @ConfigProperty(name = "relay.data.dir", defaultValue = "data") String dataDir,
            ObjectMapper mapper
    ) {
        this(Paths.get(dataDir), mapper, Clock.systemUTC());
    }

    public JsonFileTracker(Path dataDir, ObjectMapper mapper, Clock clock) {
        this.dataDir = dataDir;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.startTime = clock.instant();
    }

    @Override
    public synchronized boolean isProcessed(String sourceId) {
        return processed.contains(sourceId);
    }

    @Override
    public synchronized void recordStarted() {
        totalJobs++;
    }

    @Override
    public synchronized void recordSuccess(String sourceId, long bytes) {
        processed.add(sourceId);
        successCount++;
        totalBytes += bytes;
        save();
    }

    @Override
    public synchronized void recordFailure() {
        failureCount++;
        save();
    }

    @Override
    public synchronized void recordDuplicateSkipped() {
        duplicatesSkipped++;
    }

    @Override
    public synchronized Set<String> processedSources() {
        return Set.copyOf(processed);
    }

    @Override
    public synchronized TransferStats stats() {
        return new TransferStats(totalJobs, successCount, failureCount, duplicatesSkipped, totalBytes,
                processed.size(), startTime, lastSaved);
    }

    @Override
    public synchronized void load() {
        loadHistory();
        loadAnalytics();
        LOG.infof("Tracker loaded: %d processed sources, %d jobs", processed.size(), totalJobs);
    }

    private void loadHistory() {
        Path file = dataDir.resolve(HISTORY_FILE);
        if (!Files.exists(file)) {
            LOG.infof("No history at %s, starting fresh", file);
            return;
        }
        try {
            HistoryDocument doc = mapper.readValue(file.toFile(), HistoryDocument.class);
            processed.clear();
            if (doc == null) {
                LOG.warnf("Ignoring empty history document %s", file);
                return;
            }
            if (doc.sources() != null) {
                processed.addAll(doc.sources());
            }
        } catch (IOException e) {
            LOG.warnf("Ignoring unreadable history %s: %s", file, e.getMessage());
            processed.clear();
        }
    }

    private void loadAnalytics() {
        Path file = dataDir.resolve(ANALYTICS_FILE);
        if (!Files.exists(file)) {
            return;
        }
        try {
            AnalyticsDocument doc = mapper.readValue(file.toFile(), AnalyticsDocument.class);
            if (doc == null) {
                LOG.warnf("Ignoring empty analytics document %s", file);
                return;
            }
            totalJobs = doc.totalJobs();
            successCount = doc.successCount();
            failureCount = doc.failureCount();
            duplicatesSkipped = doc.duplicatesSkipped();
            totalBytes = doc.totalBytes();
            startTime = parseInstant(doc.startTime(), startTime);
            lastSaved = parseInstant(doc.lastSaved(), null);
        } catch (IOException e) {
            LOG.warnf("Ignoring unreadable analytics %s: %s", file, e.getMessage());
        }
    }

    @Override
    public synchronized void save() {
        Instant now = clock.instant();
        try {
            Files.createDirectories(dataDir);
            List<String> sources = new ArrayList<>(processed);
            writeAtomically(HISTORY_FILE, new HistoryDocument(sources, now.toString(), sources.size()));
            writeAtomically(ANALYTICS_FILE, new AnalyticsDocument(totalJobs, successCount, failureCount,
                    duplicatesSkipped, totalBytes, startTime.toString(), now.toString()));
            lastSaved = now;
        } catch (IOException e) {
            LOG.errorf(e, "Failed to save tracker state to %s", dataDir);
        }
    }

    @Scheduled(every = "${relay.tracker.save-interval:5m}", delayed = "${relay.tracker.save-interval:5m}")
    void periodicSave() {
        save();
    }

    private void writeAtomically(String name, Object document) throws IOException {
        Path target = dataDir.resolve(name);
        Path temp = target.resolveSibling(name + ".tmp");
        mapper.writeValue(temp.toFile(), document);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static Instant parseInstant(String value, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HistoryDocument(List<String> sources, String lastUpdated, int count) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalyticsDocument(long totalJobs, long successCount, long failureCount, long duplicatesSkipped,
                             long totalBytes, String startTime, String lastSaved) {
    }
}
