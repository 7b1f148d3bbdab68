package monops.batchengine.exception;

/**
 * Base exception for failures scoped to a single item. The item is recorded as failed
 * and the batch moves on to the next one.
 */
public abstract class ItemExecutionException extends RuntimeException {

    protected ItemExecutionException(String message) {
        super(message);
    }

    protected ItemExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
