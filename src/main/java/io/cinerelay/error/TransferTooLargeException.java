package io.cinerelay.error;

public class TransferTooLargeException extends TransferException {

    public TransferTooLargeException(long limitBytes, long actualBytes) {
        super("Payload exceeds limit of " + limitBytes + " bytes (got " + actualBytes + ")");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TOO_LARGE;
    }
}
