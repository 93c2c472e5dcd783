package io.cinerelay.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.TestFiles;
import io.cinerelay.domain.TransferStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileTrackerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private Path dataDir;

    @BeforeEach
    void setup() throws IOException {
        dataDir = Files.createTempDirectory("test-tracker-");
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(dataDir);
    }

    @Test
    void shouldPersistLedgerAndCountersAcrossRestart() throws Exception {
        JsonFileTracker tracker = new JsonFileTracker(dataDir, mapper, clock);
        tracker.load();
        tracker.recordStarted();
        tracker.recordSuccess("https://catalog/movie-a", 1_000);
        tracker.recordStarted();
        tracker.recordFailure();
        tracker.recordDuplicateSkipped();
        tracker.save();

        JsonNode history = mapper.readTree(dataDir.resolve(JsonFileTracker.HISTORY_FILE).toFile());
        assertEquals(1, history.path("count").asInt());
        assertEquals("https://catalog/movie-a", history.path("sources").get(0).asText());
        assertFalse(Files.exists(dataDir.resolve(JsonFileTracker.HISTORY_FILE + ".tmp")));

        JsonFileTracker restarted = new JsonFileTracker(dataDir, mapper, clock);
        restarted.load();

        TransferStats stats = restarted.stats();
        assertTrue(restarted.isProcessed("https://catalog/movie-a"));
        assertEquals(2, stats.totalJobs());
        assertEquals(1, stats.successCount());
        assertEquals(1, stats.failureCount());
        assertEquals(1, stats.duplicatesSkipped());
        assertEquals(1_000, stats.totalBytes());
        assertEquals(1, stats.processedSources());
        assertNotNull(stats.lastSaved());
    }

    @Test
    void repostShouldKeepLedgerASetAndCountBytes() {
        JsonFileTracker tracker = new JsonFileTracker(dataDir, mapper, clock);

        tracker.recordSuccess("movie-a", 400);
        tracker.recordSuccess("movie-a", 600);

        assertEquals(1, tracker.processedSources().size());
        assertEquals(1_000, tracker.stats().totalBytes());
        assertEquals(2, tracker.stats().successCount());
    }

    @Test
    void shouldSkipOnlyProcessedSourcesWithoutRepost() {
        JsonFileTracker tracker = new JsonFileTracker(dataDir, mapper, clock);
        tracker.recordSuccess("movie-a", 1);

        assertTrue(tracker.shouldSkip("movie-a", false));
        assertFalse(tracker.shouldSkip("movie-a", true));
        assertFalse(tracker.shouldSkip("movie-b", false));
    }

    @Test
    void shouldStartEmptyWhenFilesAreCorrupt() throws Exception {
        Files.writeString(dataDir.resolve(JsonFileTracker.HISTORY_FILE), "{not json");
        Files.writeString(dataDir.resolve(JsonFileTracker.ANALYTICS_FILE), "[1, 2");

        JsonFileTracker tracker = new JsonFileTracker(dataDir, mapper, clock);
        tracker.load();

        assertTrue(tracker.processedSources().isEmpty());
        assertEquals(0, tracker.stats().totalJobs());
    }

    @Test
    void shouldStartEmptyWhenFilesHoldJsonNull() throws Exception {
        Files.writeString(dataDir.resolve(JsonFileTracker.HISTORY_FILE), "null");
        Files.writeString(dataDir.resolve(JsonFileTracker.ANALYTICS_FILE), "null");

        JsonFileTracker tracker = new JsonFileTracker(dataDir, mapper, clock);
        tracker.load();

        assertTrue(tracker.processedSources().isEmpty());
        assertEquals(0, tracker.stats().totalJobs());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), tracker.stats().startTime());
    }

    @Test
    void shouldStartEmptyWhenDirectoryIsMissing() {
        JsonFileTracker tracker = new JsonFileTracker(dataDir.resolve("missing"), mapper, clock);
        tracker.load();

        assertTrue(tracker.processedSources().isEmpty());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), tracker.stats().startTime());
    }
}
