package monops.batchengine.exception;

/**
 * Exception thrown when a submitted transaction is mined with a failed status, or when a
 * simulated call reports that it would revert. A simulated revert carries no transaction hash.
 */
public class TransactionRevertedException extends ItemExecutionException {

    private final String txHash;

    public TransactionRevertedException(String txHash, String message) {
        super(message);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
