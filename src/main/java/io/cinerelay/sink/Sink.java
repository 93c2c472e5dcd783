package io.cinerelay.sink;

import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.error.TransferException;

public interface Sink {

    /**
     * Upload the staged payload.
     *
     * @return the destination's identifier for the uploaded item
     * @throws io.cinerelay.error.AuthExpiredException when the destination rejects the credential
     * @throws io.cinerelay.error.TransferSinkException for every other destination failure
     */
    String upload(UploadSource source, DestinationMetadata metadata) throws TransferException;
}
