package io.cinerelay.error;

/**
 * Catalog lookup failed. Surfaced to the caller as-is, never retried.
 */
public class CatalogException extends TransferException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CATALOG;
    }
}
