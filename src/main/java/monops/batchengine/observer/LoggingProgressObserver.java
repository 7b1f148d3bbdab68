package monops.batchengine.observer;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.util.LogSanitizer;

@Component
@Slf4j
public class LoggingProgressObserver implements BatchProgressObserver {

    @Override
    public void itemStarted(String batchId, OperationItem item) {
        log.debug("Batch {} item {} ({}) started", batchId, item.index(), item.kind().getWireValue());
    }

    @Override
    public void itemSucceeded(String batchId, OperationItem item, String txHash) {
        log.info("Batch {} item {} succeeded: {}", batchId, item.index(), txHash);
    }

    @Override
    public void itemFailed(String batchId, OperationItem item, String error) {
        log.warn("Batch {} item {} failed: {}", batchId, item.index(), LogSanitizer.sanitize(error));
    }

    @Override
    public void batchCompleted(String batchId, BatchReport report) {
        log.info("Batch {} completed: {} succeeded, {} failed, {} skipped",
            batchId, report.succeeded().size(), report.failed().size(), report.skipped().size());
    }

    @Override
    public void batchFailed(String batchId, String reason, BatchReport report) {
        log.error("Batch {} aborted: {} ({} item(s) never attempted)",
            batchId, LogSanitizer.sanitize(reason), report.pending().size());
    }

    @Override
    public void batchPaused(String batchId, BatchReport report) {
        log.info("Batch {} paused with {} item(s) pending", batchId, report.pending().size());
    }
}
