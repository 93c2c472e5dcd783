package io.cinerelay.staging;

import io.cinerelay.TestFiles;
import io.cinerelay.error.StagingIOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StagingStoreTest {

    private Path baseDir;
    private StagingStore store;

    @BeforeEach
    void setup() throws IOException {
        baseDir = Files.createTempDirectory("test-staging-");
        store = new StagingStore(baseDir.resolve("cache"));
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(baseDir);
    }

    @Test
    void shouldWriteFinishAndRemoveOnClose() throws Exception {
        byte[] payload = "staged payload".getBytes(StandardCharsets.UTF_8);
        Path path;

        try (StagedFile staged = store.create("job-1")) {
            staged.append(payload, 0, payload.length);
            assertEquals(payload.length, staged.size());

            path = staged.finish();
            assertEquals("job-1.part", path.getFileName().toString());
            assertArrayEquals(payload, Files.readAllBytes(path));
            assertThrows(IllegalStateException.class, () -> staged.append(payload, 0, 1));
        }

        assertFalse(Files.exists(path));
    }

    @Test
    void shouldRemoveUnfinishedFileOnFailurePath() throws Exception {
        Path path = null;
        try (StagedFile staged = store.create("job-2")) {
            path = staged.path();
            staged.append(new byte[]{1, 2, 3}, 0, 3);
            throw new IllegalStateException("download failed");
        } catch (IllegalStateException expected) {
            // staging file closed by try-with-resources
        }
        assertFalse(Files.exists(path));
    }

    @Test
    void shouldRefuseSecondFileForSameJob() throws Exception {
        try (StagedFile ignored = store.create("job-3")) {
            assertThrows(StagingIOException.class, () -> store.create("job-3"));
        }
    }

    @Test
    void removeShouldBeIdempotent() throws Exception {
        StagedFile staged = store.create("job-4");
        staged.close();
        staged.close();
        store.remove(staged.path());
        store.remove(null);

        assertEquals(0, TestFiles.countFiles(store.baseDir(), "*"));
    }

    @Test
    void purgeShouldDeleteOnlyLeftoverPartFiles() throws Exception {
        Files.createDirectories(store.baseDir());
        Files.writeString(store.baseDir().resolve("111.part"), "x");
        Files.writeString(store.baseDir().resolve("222.part"), "y");
        Files.writeString(store.baseDir().resolve("notes.txt"), "keep");

        assertEquals(2, store.purge());

        assertEquals(0, TestFiles.countFiles(store.baseDir(), "*.part"));
        assertTrue(Files.exists(store.baseDir().resolve("notes.txt")));
    }

    @Test
    void purgeShouldTolerateMissingDirectory() {
        assertEquals(0, store.purge());
    }
}
