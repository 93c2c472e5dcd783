package io.cinerelay.error;

public class DuplicateSourceException extends TransferException {

    private final String sourceId;

    public DuplicateSourceException(String sourceId) {
        super("Source already processed: " + sourceId);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE;
    }
}
