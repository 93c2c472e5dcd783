package io.cinerelay.staging;

import io.cinerelay.error.StagingIOException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Local scratch files, one per job.
 * Callers acquire a {@link StagedFile} with try-with-resources so the file is removed
 * on success, failure and cancellation alike.
 */
@ApplicationScoped
public class StagingStore {

    private static final Logger LOG = Logger.getLogger(StagingStore.class);

    static final String SUFFIX = ".part";

    private final Path baseDir;

    @Inject
    public StagingStore(@ConfigProperty(name = "relay.staging.dir", defaultValue = "data/cache") String dir) {
        this(Paths.get(dir));
    }

    public StagingStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Create the staging file for a job. Fails if one already exists for that id.
     */
    public StagedFile create(String jobId) throws StagingIOException {
        Path path = baseDir.resolve(jobId + SUFFIX);
        try {
            Files.createDirectories(baseDir);
            OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            LOG.debugf("Created staging file %s", path);
            return new StagedFile(this, path, out);
        } catch (IOException e) {
            throw new StagingIOException("Failed to create staging file " + path, e);
        }
    }

    /**
     * Idempotent. Missing files are fine; I/O errors are logged and not propagated.
     */
    public void remove(Path path) {
        if (path == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(path)) {
                LOG.debugf("Removed staging file %s", path);
            }
        } catch (IOException e) {
            LOG.warnf(e, "Failed to remove staging file %s", path);
        }
    }

    /**
     * Discard files left behind by a previous run. Staged bytes are never resumed.
     */
    public int purge() {
        if (!Files.isDirectory(baseDir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(baseDir, "*" + SUFFIX)) {
            for (Path leftover : leftovers) {
                remove(leftover);
                removed++;
            }
        } catch (IOException e) {
            LOG.warnf(e, "Failed to list staging directory %s", baseDir);
        }
        if (removed > 0) {
            LOG.infof("Discarded %d leftover staging file(s) in %s", removed, baseDir);
        }
        return removed;
    }
}
