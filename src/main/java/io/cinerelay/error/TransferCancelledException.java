package io.cinerelay.error;

/**
 * Raised when a stage observes the job's cancelled flag. Not a failure.
 */
public class TransferCancelledException extends TransferException {

    public TransferCancelledException() {
        super("Task cancelled by user");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLED;
    }
}
