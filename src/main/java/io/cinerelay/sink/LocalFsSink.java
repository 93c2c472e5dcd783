package io.cinerelay.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.error.TransferException;
import io.cinerelay.error.TransferSinkException;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Simple local filesystem sink for development.
 * Copies the payload chunk by chunk into a configured directory and writes the metadata next to it.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class LocalFsSink implements Sink {

    private static final Logger LOG = Logger.getLogger(LocalFsSink.class);

    private final Path basePath;
    private final ObjectMapper mapper;

    @Inject
    public LocalFsSink(
            @ConfigProperty(name = "sink.local.path", defaultValue = "/tmp/relay-sink") String path,
            ObjectMapper mapper
    ) {
        this(Paths.get(path), mapper);
    }

    public LocalFsSink(Path basePath, ObjectMapper mapper) {
        this.basePath = basePath;
        this.mapper = mapper;
    }

    public Path basePath() {
        return basePath;
    }

    @Override
    public String upload(UploadSource source, DestinationMetadata metadata) throws TransferException {
        String externalId = "local-" + UUID.randomUUID();
        Path target = basePath.resolve(externalId + ".bin");

        // Temp file, renamed once every chunk is written
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            Files.createDirectories(basePath);
            writeChunks(source, temp);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            mapper.writeValue(basePath.resolve(externalId + ".json").toFile(), metadata);
        } catch (IOException e) {
            deleteTemp(temp);
            throw new TransferSinkException("Local sink write failed: " + e.getMessage(), e);
        }

        LOG.debugf("Stored %s as %s (%d bytes)", metadata.title(), target, source.size());
        return externalId;
    }

    private void writeChunks(UploadSource source, Path temp) throws IOException {
        try (OutputStream out = Files.newOutputStream(temp)) {
            long offset = 0;
            while (offset < source.size()) {
                int length = (int) Math.min(source.chunkSize(), source.size() - offset);
                try (InputStream in = source.openChunk(offset, length)) {
                    in.transferTo(out);
                }
                offset += length;
            }
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to delete temp file %s", temp);
        }
    }
}
