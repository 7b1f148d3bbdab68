package monops.batchengine.exception;

/**
 * Exception thrown when the signer cannot be reached or has been disconnected
 */
public class SignerUnavailableException extends FatalBatchException {
    public SignerUnavailableException(String message) {
        super(message);
    }

    public SignerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
