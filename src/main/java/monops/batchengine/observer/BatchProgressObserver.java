package monops.batchengine.observer;

import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.dto.batch.OperationItem;

/**
 * Lifecycle callbacks for a running batch. Each slot fires synchronously on the batch's
 * worker thread after the matching store write has completed, so an observer that re-reads
 * the store sees the new state. Observers should return quickly; exceptions they throw are
 * logged and otherwise ignored.
 */
public interface BatchProgressObserver {

    BatchProgressObserver NONE = new BatchProgressObserver() { };

    default void itemStarted(String batchId, OperationItem item) {
    }

    default void itemSucceeded(String batchId, OperationItem item, String txHash) {
    }

    default void itemFailed(String batchId, OperationItem item, String error) {
    }

    default void batchCompleted(String batchId, BatchReport report) {
    }

    default void batchFailed(String batchId, String reason, BatchReport report) {
    }

    default void batchPaused(String batchId, BatchReport report) {
    }
}
