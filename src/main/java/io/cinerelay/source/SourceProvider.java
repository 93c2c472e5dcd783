package io.cinerelay.source;

import io.cinerelay.error.TransferException;

import java.net.URI;
import java.time.Duration;

public interface SourceProvider {

    boolean supports(URI url);

    /**
     * Open the payload stream. {@code timeout} bounds connection setup; the caller enforces the overall deadline.
     */
    SourceConnection open(URI url, Duration timeout) throws TransferException;
}
