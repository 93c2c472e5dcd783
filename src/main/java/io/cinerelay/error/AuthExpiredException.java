package io.cinerelay.error;

/**
 * The upload credential is expired or invalid. Retrying will not help;
 * the operator has to re-authenticate the upload account.
 */
public class AuthExpiredException extends TransferException {

    public static final String ACTION = "Upload authentication expired. Please re-authenticate the upload account.";

    public AuthExpiredException(String detail) {
        super(ACTION + " (" + detail + ")");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTH_EXPIRED;
    }
}
