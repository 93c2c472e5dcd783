package io.cinerelay.error;

public class TransferTimeoutException extends TransferException {

    public TransferTimeoutException(String message) {
        super(message);
    }

    public TransferTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
