package monops.batchengine.exception;

import java.util.List;

/**
 * Exception thrown when a batch cannot resume because some in-flight items could not be
 * resolved against the chain
 */
public class UnreconciledBatchException extends IllegalStateException {

    private final String batchId;
    private final List<Integer> unresolvedIndices;

    public UnreconciledBatchException(String batchId, List<Integer> unresolvedIndices) {
        super("Batch " + batchId + " has unresolved in-flight items " + unresolvedIndices);
        this.batchId = batchId;
        this.unresolvedIndices = List.copyOf(unresolvedIndices);
    }

    public String getBatchId() {
        return batchId;
    }

    public List<Integer> getUnresolvedIndices() {
        return unresolvedIndices;
    }
}
