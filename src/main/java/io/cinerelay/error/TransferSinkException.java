package io.cinerelay.error;

/**
 * Destination rejected or failed the upload. Carries the destination's own message.
 */
public class TransferSinkException extends TransferException {

    public TransferSinkException(String message) {
        super(message);
    }

    public TransferSinkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SINK;
    }
}
