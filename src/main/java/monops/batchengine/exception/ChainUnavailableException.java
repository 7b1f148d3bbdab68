package monops.batchengine.exception;

/**
 * Exception thrown when the RPC endpoint is unreachable
 */
public class ChainUnavailableException extends FatalBatchException {
    public ChainUnavailableException(String message) {
        super(message);
    }

    public ChainUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
