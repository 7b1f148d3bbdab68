package monops.batchengine.service.execution;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;
import monops.batchengine.exception.FatalBatchException;
import monops.batchengine.service.chain.ChainQuery;
import monops.batchengine.service.chain.ConfirmationOutcome;
import monops.batchengine.service.persistence.BatchStateStore;
import monops.batchengine.util.LogSanitizer;

/**
 * Settles items left in flight by an interrupted run. An item with a transaction hash is
 * looked up on chain; an item without one was never broadcast and goes back to pending.
 */
@Service
@Slf4j
public class BatchReconciler {

    private final BatchStateStore store;
    private final ChainQuery chainQuery;
    private final Clock clock;

    public BatchReconciler(BatchStateStore store, ChainQuery chainQuery, Clock clock) {
        this.store = store;
        this.chainQuery = chainQuery;
        this.clock = clock;
    }

    /**
     * @return indices still in flight afterwards, because their transaction is not yet known on chain
     */
    public List<Integer> reconcile(String batchId) {
        BatchState state = store.read(batchId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown batch: " + batchId));
        List<Integer> unresolved = new ArrayList<>();
        for (ItemExecutionRecord record : state.withStatus(ItemStatus.IN_FLIGHT)) {
            if (record.getTxHash() == null) {
                record.revertToPending();
                store.writeItemRecord(batchId, record.getIndex(), record);
                log.info("Batch {} item {} was never broadcast, back to pending", batchId, record.getIndex());
                continue;
            }
            Optional<ConfirmationOutcome> outcome;
            try {
                outcome = chainQuery.lookupConfirmation(record.getTxHash());
            } catch (FatalBatchException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Lookup of {} for batch {} item {} failed: {}", record.getTxHash(), batchId,
                    record.getIndex(), LogSanitizer.sanitize(e.getMessage()));
                unresolved.add(record.getIndex());
                continue;
            }
            if (outcome.isEmpty()) {
                unresolved.add(record.getIndex());
                continue;
            }
            ConfirmationOutcome confirmation = outcome.get();
            if (confirmation.confirmed()) {
                record.markSucceeded(confirmation.gasUsed(), confirmation.blockNumber(), clock.instant());
            } else {
                String detail = confirmation.detail() != null ? confirmation.detail() : "transaction reverted";
                record.markFailed(LogSanitizer.truncate(detail, LogSanitizer.MAX_ERROR_LENGTH), clock.instant());
            }
            store.writeItemRecord(batchId, record.getIndex(), record);
            log.info("Batch {} item {} reconciled as {}", batchId, record.getIndex(), record.getStatus().getWireValue());
        }
        if (!unresolved.isEmpty()) {
            log.warn("Batch {} has {} unresolved in-flight item(s): {}", batchId, unresolved.size(), unresolved);
        }
        return unresolved;
    }
}
