package io.cinerelay.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.TestFiles;
import io.cinerelay.domain.ControlFlags;
import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.error.AuthExpiredException;
import io.cinerelay.error.TransferCancelledException;
import io.cinerelay.error.TransferSinkException;
import io.cinerelay.progress.ProgressReporter;
import io.cinerelay.progress.TransferProgress;
import io.cinerelay.sink.LocalFsSink;
import io.cinerelay.sink.Sink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadStageTest {

    private static final DestinationMetadata METADATA = new DestinationMetadata("Movie", null, null, null, null);

    private Path baseDir;
    private Path staged;
    private byte[] payload;
    private final ControlFlags flags = new ControlFlags();
    private final List<TransferProgress> samples = new CopyOnWriteArrayList<>();
    private final ProgressReporter reporter = samples::add;

    @BeforeEach
    void setup() throws IOException {
        baseDir = Files.createTempDirectory("test-upload-");
        payload = new byte[2_500];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        staged = Files.write(baseDir.resolve("job.part"), payload);
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(baseDir);
    }

    @Test
    void shouldUploadInChunksAndReportProgress() throws Exception {
        LocalFsSink sink = new LocalFsSink(baseDir.resolve("sink"), new ObjectMapper());
        UploadStage stage = new UploadStage(sink, 1_000, 20);

        String externalId = stage.upload(staged, METADATA, flags, reporter);

        assertTrue(externalId.startsWith("local-"));
        assertArrayEquals(payload, Files.readAllBytes(sink.basePath().resolve(externalId + ".bin")));
        assertTrue(Files.exists(sink.basePath().resolve(externalId + ".json")));

        assertEquals(0, samples.get(0).bytesMoved());
        assertEquals(2_500, samples.get(samples.size() - 1).bytesMoved());
        assertEquals(2_500, samples.get(samples.size() - 1).totalBytes());
    }

    @Test
    void resentChunkShouldNotMoveProgressBackwards() throws Exception {
        Sink resending = (source, metadata) -> {
            try {
                readChunk(source.openChunk(0, 1_000));
                readChunk(source.openChunk(1_000, 1_000));
                readChunk(source.openChunk(1_000, 1_000));
                readChunk(source.openChunk(2_000, 500));
                return "id-1";
            } catch (IOException e) {
                throw new TransferSinkException("chunk read failed", e);
            }
        };
        UploadStage stage = new UploadStage(resending, 1_000, 20);

        assertEquals("id-1", stage.upload(staged, METADATA, flags, reporter));

        long previous = -1;
        for (TransferProgress sample : samples) {
            assertTrue(sample.bytesMoved() > previous, "progress went from " + previous + " to " + sample.bytesMoved());
            previous = sample.bytesMoved();
        }
        assertEquals(2_500, previous);
    }

    @Test
    void cancelDuringUploadShouldBecomeCancellation() {
        Sink cancelling = (source, metadata) -> {
            try {
                readChunk(source.openChunk(0, 1_000));
                flags.cancel();
                readChunk(source.openChunk(1_000, 1_000));
                return "never";
            } catch (IOException e) {
                throw new TransferSinkException("chunk read failed", e);
            }
        };
        UploadStage stage = new UploadStage(cancelling, 1_000, 20);

        assertThrows(TransferCancelledException.class, () -> stage.upload(staged, METADATA, flags, reporter));
    }

    @Test
    void authExpiryShouldPassThroughUnchanged() {
        Sink expired = (source, metadata) -> {
            throw new AuthExpiredException("HTTP 401");
        };
        UploadStage stage = new UploadStage(expired, 1_000, 20);

        AuthExpiredException e = assertThrows(AuthExpiredException.class,
                () -> stage.upload(staged, METADATA, flags, reporter));
        assertTrue(e.getMessage().contains("HTTP 401"));
    }

    @Test
    void shouldNotStartWhenAlreadyCancelled() {
        flags.cancel();
        Sink failing = (source, metadata) -> {
            throw new AssertionError("sink must not be called");
        };
        UploadStage stage = new UploadStage(failing, 1_000, 20);

        assertThrows(TransferCancelledException.class, () -> stage.upload(staged, METADATA, flags, reporter));
    }

    private static void readChunk(InputStream in) throws IOException {
        try (in) {
            in.readAllBytes();
        }
    }
}
