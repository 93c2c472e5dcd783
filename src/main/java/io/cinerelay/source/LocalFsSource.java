package io.cinerelay.source;

import io.cinerelay.error.TransferException;
import io.cinerelay.error.TransferNetworkException;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Source provider for local filesystem.
 * Handles file:// URIs, used for development and tests.
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    @Override
    public boolean supports(URI url) {
        return "file".equalsIgnoreCase(url.getScheme());
    }

    @Override
    public SourceConnection open(URI url, Duration timeout) throws TransferException {
        Path path = Paths.get(url);
        try {
            long size = Files.size(path);
            InputStream in = Files.newInputStream(path);
            return new SourceConnection(in, size);
        } catch (NoSuchFileException e) {
            throw new TransferNetworkException("Source path does not exist: " + path, e);
        } catch (IOException e) {
            throw new TransferNetworkException("Failed to open source " + path + ": " + e.getMessage(), e);
        }
    }
}
