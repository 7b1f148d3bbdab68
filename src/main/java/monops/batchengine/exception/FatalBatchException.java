package monops.batchengine.exception;

/**
 * Base exception for failures that make continuing the batch unsafe or pointless.
 * The run halts and the batch is marked failed with the message as reason.
 */
public abstract class FatalBatchException extends RuntimeException {

    protected FatalBatchException(String message) {
        super(message);
    }

    protected FatalBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
