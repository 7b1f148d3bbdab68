package monops.batchengine.exception;

/**
 * Exception thrown when no receipt shows up for a submitted transaction within the polling window
 */
public class ConfirmationTimeoutException extends ItemExecutionException {

    private final String txHash;

    public ConfirmationTimeoutException(String txHash, String message) {
        super(message);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
