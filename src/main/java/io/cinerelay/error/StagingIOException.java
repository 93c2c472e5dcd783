package io.cinerelay.error;

public class StagingIOException extends TransferException {

    public StagingIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STAGING_IO;
    }
}
