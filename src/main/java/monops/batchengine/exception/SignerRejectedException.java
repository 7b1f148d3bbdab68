package monops.batchengine.exception;

/**
 * Exception thrown when the signer refuses to sign or broadcast an item
 */
public class SignerRejectedException extends ItemExecutionException {
    public SignerRejectedException(String message) {
        super(message);
    }

    public SignerRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
