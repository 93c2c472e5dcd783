package io.cinerelay.error;

public class TransferNetworkException extends TransferException {

    public TransferNetworkException(String message) {
        super(message);
    }

    public TransferNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NETWORK;
    }
}
