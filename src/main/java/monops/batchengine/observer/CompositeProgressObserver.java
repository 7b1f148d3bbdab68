package monops.batchengine.observer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.util.LogSanitizer;

/**
 * Fans each callback out to a fixed list of observers. A delegate that throws is logged
 * and skipped; the remaining delegates still receive the event.
 */
@Slf4j
public class CompositeProgressObserver implements BatchProgressObserver {

    private final List<BatchProgressObserver> delegates;

    public CompositeProgressObserver(List<BatchProgressObserver> delegates) {
        this.delegates = delegates.stream().filter(Objects::nonNull).toList();
    }

    public static BatchProgressObserver of(BatchProgressObserver... observers) {
        List<BatchProgressObserver> list = new ArrayList<>();
        for (BatchProgressObserver observer : observers) {
            if (observer != null && observer != NONE) {
                list.add(observer);
            }
        }
        return new CompositeProgressObserver(list);
    }

    public List<BatchProgressObserver> delegates() {
        return delegates;
    }

    @Override
    public void itemStarted(String batchId, OperationItem item) {
        each("itemStarted", o -> o.itemStarted(batchId, item));
    }

    @Override
    public void itemSucceeded(String batchId, OperationItem item, String txHash) {
        each("itemSucceeded", o -> o.itemSucceeded(batchId, item, txHash));
    }

    @Override
    public void itemFailed(String batchId, OperationItem item, String error) {
        each("itemFailed", o -> o.itemFailed(batchId, item, error));
    }

    @Override
    public void batchCompleted(String batchId, BatchReport report) {
        each("batchCompleted", o -> o.batchCompleted(batchId, report));
    }

    @Override
    public void batchFailed(String batchId, String reason, BatchReport report) {
        each("batchFailed", o -> o.batchFailed(batchId, reason, report));
    }

    @Override
    public void batchPaused(String batchId, BatchReport report) {
        each("batchPaused", o -> o.batchPaused(batchId, report));
    }

    private void each(String slot, Consumer<BatchProgressObserver> call) {
        for (BatchProgressObserver delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                log.warn("Observer {} threw from {}: {}", delegate.getClass().getSimpleName(), slot,
                    LogSanitizer.sanitize(e.getMessage()));
            }
        }
    }
}
