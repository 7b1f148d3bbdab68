package monops.batchengine.exception;

/**
 * Exception thrown when the batch state store cannot read or persist state
 */
public class BatchStoreException extends FatalBatchException {
    public BatchStoreException(String message) {
        super(message);
    }

    public BatchStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
