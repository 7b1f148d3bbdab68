package monops.batchengine.service.persistence;

import java.util.List;
import java.util.Optional;

import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.OperationItem;

/**
 * Durable record of batches and their per-item execution records. Implementations keep no
 * business rules; they store what they are given and return copies. Storage failures are
 * raised as {@link monops.batchengine.exception.BatchStoreException}.
 */
public interface BatchStateStore {

    /**
     * Stores a new batch together with its initial item records.
     *
     * @throws IllegalStateException if a batch with the same id already exists
     * @throws IllegalArgumentException if items and records are not indexed by position
     */
    void create(BatchState initial);

    /**
     * Stores a new batch with one Pending record per item.
     */
    default void create(Batch batch) {
        create(new BatchState(batch, batch.getItems().stream()
            .map(item -> ItemExecutionRecord.pending(item.index()))
            .toList()));
    }

    Optional<BatchState> read(String batchId);

    void writeItemRecord(String batchId, int index, ItemExecutionRecord record);

    void writeBatchStatus(String batchId, BatchStatus status, String reason);

    default void writeBatchStatus(String batchId, BatchStatus status) {
        writeBatchStatus(batchId, status, null);
    }

    /**
     * @return indices of Pending records in ascending order; empty for an unknown batch
     */
    List<Integer> listPending(String batchId);

    /**
     * @return the account's batches, most recently created first
     */
    List<BatchState> findBySigner(String signerAccount, int limit);

    boolean delete(String batchId);

    /**
     * Checks that items and records are both indexed 0..n-1 by position, one record per item.
     *
     * @throws IllegalArgumentException on the first mismatch
     */
    static void requireConsistent(BatchState state) {
        List<OperationItem> items = state.batch().getItems();
        List<ItemExecutionRecord> records = state.records();
        if (items == null || items.size() != records.size()) {
            throw new IllegalArgumentException("Batch " + state.batch().getBatchId() + " has "
                + (items == null ? 0 : items.size()) + " item(s) but " + records.size() + " record(s)");
        }
        for (int i = 0; i < items.size(); i++) {
            OperationItem item = items.get(i);
            if (item == null || item.index() != i) {
                throw new IllegalArgumentException("Item at position " + i + " has index "
                    + (item == null ? "none" : String.valueOf(item.index())));
            }
            if (records.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Record at position " + i + " has index " + records.get(i).getIndex());
            }
        }
    }
}
