package monops.batchengine.exception;

/**
 * Exception thrown when a broadcast gets no answer in time. The node may still have the
 * transaction, so its outcome is decided by the receipt for {@link #getTxHash()}.
 */
public class SubmissionTimeoutException extends ItemExecutionException {

    private final String txHash;

    public SubmissionTimeoutException(String txHash, String message, Throwable cause) {
        super(message, cause);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
