package monops.batchengine.service.execution;

import java.time.Clock;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.exception.BatchCancelledException;
import monops.batchengine.exception.BatchStoreException;
import monops.batchengine.exception.FatalBatchException;
import monops.batchengine.exception.SubmissionTimeoutException;
import monops.batchengine.exception.TransactionRevertedException;
import monops.batchengine.observer.BatchProgressObserver;
import monops.batchengine.observer.CompositeProgressObserver;
import monops.batchengine.service.chain.ChainQuery;
import monops.batchengine.service.chain.ConfirmationOutcome;
import monops.batchengine.service.chain.SignedTransaction;
import monops.batchengine.service.chain.Signer;
import monops.batchengine.service.persistence.BatchStateStore;
import monops.batchengine.util.LogSanitizer;

/**
 * Drives a stored batch one item at a time, in index order, until it completes, pauses or
 * fails. Every transition is written to the store before observers hear about it, and the
 * store is re-read before each item so a resumed run never repeats finished work.
 *
 * Per-item failures are recorded and the run moves on; a {@link FatalBatchException}
 * stops the run and leaves the current item exactly as last persisted. Any other unexpected
 * error is handled the same way as a fatal one.
 *
 * A transaction hash is persisted before the transaction is broadcast, so an in-flight item
 * without a hash was never sent.
 */
@Service
@Slf4j
public class SequentialExecutor {

    private final BatchStateStore store;
    private final Signer signer;
    private final ChainQuery chainQuery;
    private final Clock clock;

    public SequentialExecutor(BatchStateStore store, Signer signer, ChainQuery chainQuery, Clock clock) {
        this.store = store;
        this.signer = signer;
        this.chainQuery = chainQuery;
        this.clock = clock;
    }

    /**
     * Runs the batch on the calling thread.
     *
     * @throws IllegalArgumentException if the batch does not exist
     * @throws IllegalStateException if the batch is not in a runnable status
     */
    public BatchReport run(String batchId, BatchHandle handle, BatchProgressObserver observer) {
        BatchProgressObserver events = CompositeProgressObserver.of(observer);
        BatchState state = store.read(batchId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown batch: " + batchId));
        Batch batch = state.batch();
        if (!batch.getStatus().isRunnable()) {
            throw new IllegalStateException("Batch " + batchId + " is " + batch.getStatus().getWireValue());
        }

        BatchState lastKnown = state;
        try {
            store.writeBatchStatus(batchId, BatchStatus.RUNNING);
            log.info("Batch {} running: {} item(s) for {}", batchId, batch.getItems().size(),
                LogSanitizer.maskAddress(batch.getSignerAccount()));

            for (OperationItem item : batch.getItems()) {
                lastKnown = current(batchId);
                ItemExecutionRecord record = lastKnown.record(item.index())
                    .orElseThrow(() -> new BatchStoreException("Missing record for item " + item.index()));
                if (record.getStatus() != ItemStatus.PENDING) {
                    continue;
                }
                if (handle.cancelRequested()) {
                    throw new BatchCancelledException();
                }
                if (handle.pauseRequested() || lastKnown.batch().getStatus() == BatchStatus.PAUSED) {
                    store.writeBatchStatus(batchId, BatchStatus.PAUSED);
                    BatchReport report = BatchReport.from(current(batchId));
                    log.info("Batch {} paused before item {}", batchId, item.index());
                    events.batchPaused(batchId, report);
                    return report;
                }
                executeItem(batchId, batch.getSignerAccount(), item, record, events);
            }

            lastKnown = current(batchId);
            if (!lastKnown.allTerminal()) {
                throw new BatchStoreException("Batch " + batchId + " finished with unresolved items");
            }
            store.writeBatchStatus(batchId, BatchStatus.COMPLETED);
            BatchReport report = BatchReport.from(current(batchId));
            events.batchCompleted(batchId, report);
            return report;
        } catch (FatalBatchException e) {
            return abort(batchId, LogSanitizer.errorMessage(e), lastKnown, events);
        } catch (RuntimeException e) {
            log.error("Batch {} hit an unexpected error", batchId, e);
            return abort(batchId, "unexpected error: " + LogSanitizer.errorMessage(e), lastKnown, events);
        }
    }

    private void executeItem(String batchId, String account, OperationItem item,
                             ItemExecutionRecord record, BatchProgressObserver events) {
        record.markInFlight(clock.instant());
        store.writeItemRecord(batchId, item.index(), record);
        events.itemStarted(batchId, item);

        SignedTransaction signed;
        try {
            signed = signer.sign(item, account);
        } catch (FatalBatchException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(batchId, item, record, LogSanitizer.errorMessage(e), events);
            return;
        }
        if (signed == null || signed.txHash() == null || signed.txHash().isBlank()) {
            fail(batchId, item, record, "signer returned no transaction hash", events);
            return;
        }
        String txHash = signed.txHash();
        record.recordTxHash(txHash);
        store.writeItemRecord(batchId, item.index(), record);

        try {
            signer.broadcast(signed);
        } catch (SubmissionTimeoutException e) {
            log.warn("Batch {} item {} broadcast timed out, waiting for a receipt of {}", batchId, item.index(), txHash);
        } catch (FatalBatchException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(batchId, item, record, LogSanitizer.errorMessage(e), events);
            return;
        }

        ConfirmationOutcome outcome;
        try {
            outcome = awaitSuccess(txHash);
        } catch (FatalBatchException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(batchId, item, record, LogSanitizer.errorMessage(e), events);
            return;
        }
        record.markSucceeded(outcome.gasUsed(), outcome.blockNumber(), clock.instant());
        store.writeItemRecord(batchId, item.index(), record);
        events.itemSucceeded(batchId, item, txHash);
    }

    private ConfirmationOutcome awaitSuccess(String txHash) {
        ConfirmationOutcome outcome = chainQuery.getConfirmation(txHash);
        if (!outcome.confirmed()) {
            throw new TransactionRevertedException(txHash,
                outcome.detail() != null ? outcome.detail() : "transaction reverted");
        }
        return outcome;
    }

    private void fail(String batchId, OperationItem item, ItemExecutionRecord record, String reason,
                      BatchProgressObserver events) {
        record.markFailed(reason, clock.instant());
        store.writeItemRecord(batchId, item.index(), record);
        log.warn("Batch {} item {} failed: {}", batchId, item.index(), reason);
        events.itemFailed(batchId, item, reason);
    }

    private BatchReport abort(String batchId, String reason, BatchState lastKnown, BatchProgressObserver events) {
        log.error("Batch {} aborted: {}", batchId, reason);
        BatchReport report;
        try {
            store.writeBatchStatus(batchId, BatchStatus.FAILED, reason);
            report = BatchReport.from(current(batchId));
        } catch (RuntimeException storeError) {
            log.error("Unable to record failure of batch {}: {}", batchId, LogSanitizer.sanitize(storeError.getMessage()));
            BatchState snapshot = lastKnown.copy();
            snapshot.batch().setStatus(BatchStatus.FAILED);
            snapshot.batch().setFailureReason(reason);
            report = BatchReport.from(snapshot);
        }
        events.batchFailed(batchId, reason, report);
        return report;
    }

    private BatchState current(String batchId) {
        return store.read(batchId)
            .orElseThrow(() -> new BatchStoreException("Batch " + batchId + " disappeared from the store"));
    }
}
