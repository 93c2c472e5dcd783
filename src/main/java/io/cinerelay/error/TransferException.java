package io.cinerelay.error;

/**
 * Base type for every failure raised while resolving, downloading or uploading a job.
 */
public abstract class TransferException extends Exception {

    protected TransferException(String message) {
        super(message);
    }

    protected TransferException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
