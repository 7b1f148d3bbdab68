package monops.batchengine.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchReport;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;
import monops.batchengine.dto.batch.ItemValidation;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.dto.batch.PreflightOutcome;
import monops.batchengine.dto.batch.PreflightReport;
import monops.batchengine.exception.BatchCancelledException;
import monops.batchengine.exception.BatchRejectedException;
import monops.batchengine.exception.UnreconciledBatchException;
import monops.batchengine.observer.BatchProgressObserver;
import monops.batchengine.observer.CompositeProgressObserver;
import monops.batchengine.observer.LoggingProgressObserver;
import monops.batchengine.observer.WebhookProgressObserver;
import monops.batchengine.service.execution.BatchHandle;
import monops.batchengine.service.execution.BatchReconciler;
import monops.batchengine.service.execution.SequentialExecutor;
import monops.batchengine.service.persistence.BatchStateStore;
import monops.batchengine.service.preflight.PlanLimitResolver;
import monops.batchengine.service.preflight.PreflightValidator;
import monops.batchengine.util.EthereumAddressValidator;
import monops.batchengine.util.LogSanitizer;

/**
 * Entry point for batch operations: validate, create, run, pause, resume and inspect.
 *
 * Each batch runs on its own worker from the injected executor, and at most one run per
 * batch id is active in this process. Keeping two batches of the same account from running
 * at the same time is up to the caller.
 */
@Service
@Slf4j
public class BatchEngine {

    private final PreflightValidator preflightValidator;
    private final PlanLimitResolver planLimitResolver;
    private final BatchStateStore store;
    private final SequentialExecutor sequentialExecutor;
    private final BatchReconciler reconciler;
    private final LoggingProgressObserver loggingObserver;
    private final WebhookProgressObserver webhookObserver;
    private final Executor runExecutor;
    private final Clock clock;

    private final Map<String, BatchHandle> activeRuns = new ConcurrentHashMap<>();

    public BatchEngine(
        PreflightValidator preflightValidator,
        PlanLimitResolver planLimitResolver,
        BatchStateStore store,
        SequentialExecutor sequentialExecutor,
        BatchReconciler reconciler,
        LoggingProgressObserver loggingObserver,
        WebhookProgressObserver webhookObserver,
        @Qualifier("batchRunExecutor") Executor runExecutor,
        Clock clock
    ) {
        this.preflightValidator = preflightValidator;
        this.planLimitResolver = planLimitResolver;
        this.store = store;
        this.sequentialExecutor = sequentialExecutor;
        this.reconciler = reconciler;
        this.loggingObserver = loggingObserver;
        this.webhookObserver = webhookObserver;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /**
     * Preflight under the account's own plan tier.
     */
    public PreflightOutcome preflight(List<OperationItem> items, String account) {
        return preflight(items, account, planLimitResolver.limitFor(account));
    }

    public PreflightOutcome preflight(List<OperationItem> items, String account, int planLimit) {
        return preflightValidator.preflight(items, account, planLimit);
    }

    /**
     * Persists a validated batch built from a preflight outcome. With {@code force}, items
     * that failed preflight are stored as skipped with their reason and the rest run normally.
     *
     * @throws BatchRejectedException if the outcome is invalid and not forced, if no item is valid,
     *         or if any item is missing or not indexed by its position
     */
    public Batch createBatch(String account, PreflightOutcome outcome, boolean force) {
        PreflightReport report = outcome.report();
        if (!report.overallValid()) {
            if (!force) {
                throw new BatchRejectedException("Preflight failed for " + report.invalidIndices().size()
                    + " item(s): " + report.batchReasons(), report);
            }
            boolean anyValid = report.perItem().values().stream().anyMatch(ItemValidation::valid);
            if (!anyValid) {
                throw new BatchRejectedException("No valid items to execute", report);
            }
        }
        List<OperationItem> items = outcome.acceptedItems();
        for (int i = 0; i < items.size(); i++) {
            OperationItem item = items.get(i);
            if (item == null || item.index() != i) {
                throw new BatchRejectedException("Item at position " + i + " is "
                    + (item == null ? "missing" : "indexed " + item.index()) + "; items must be indexed by position", report);
            }
        }
        String signer = EthereumAddressValidator.normalize(account);
        Instant now = clock.instant();
        Batch batch = Batch.draft(signer, outcome.acceptedItems(), outcome.discardedCount(), outcome.planLimit(), now);
        batch.setStatus(BatchStatus.VALIDATED);

        List<ItemExecutionRecord> records = new ArrayList<>();
        for (OperationItem item : batch.getItems()) {
            ItemExecutionRecord record = ItemExecutionRecord.pending(item.index());
            ItemValidation validation = report.item(item.index());
            if (validation != null && !validation.valid()) {
                record.markSkipped(validation.reason(), now);
            }
            records.add(record);
        }
        store.create(new BatchState(batch, records));
        log.info("Batch {} created for {}: {} item(s), {} skipped, {} discarded by plan limit",
            batch.getBatchId(), LogSanitizer.maskAddress(signer), records.size(),
            records.stream().filter(r -> r.getStatus() == ItemStatus.SKIPPED).count(), outcome.discardedCount());
        return batch.copy();
    }

    /**
     * Starts a run of the batch. A batch not yet in the store is stored first, which requires
     * it to be VALIDATED, non-empty, indexed by position and within its plan limit.
     *
     * @throws IllegalArgumentException if a new batch breaks its item layout or plan limit
     */
    public BatchHandle execute(Batch batch, BatchProgressObserver observer) {
        if (store.read(batch.getBatchId()).isEmpty()) {
            if (batch.getStatus() != BatchStatus.VALIDATED) {
                throw new IllegalStateException("Only a validated batch can be executed, got " + batch.getStatus());
            }
            requireRunnableLayout(batch);
            store.create(batch);
        }
        return execute(batch.getBatchId(), observer);
    }

    public BatchHandle execute(String batchId, BatchProgressObserver observer) {
        BatchState state = require(batchId);
        BatchStatus status = state.batch().getStatus();
        if (status != BatchStatus.VALIDATED) {
            throw new IllegalStateException("Batch " + batchId + " is " + status.getWireValue() + "; use resume");
        }
        return start(batchId, observer);
    }

    /**
     * Requests a pause at the next item boundary. A batch with no active run in this process
     * but left RUNNING (for example after a crash) is marked PAUSED directly.
     */
    public void pause(String batchId) {
        BatchHandle handle = activeRuns.get(batchId);
        if (handle != null) {
            handle.pause();
            log.info("Pause requested for batch {}", batchId);
            return;
        }
        BatchStatus status = require(batchId).batch().getStatus();
        if (status == BatchStatus.PAUSED) {
            return;
        }
        if (status != BatchStatus.RUNNING) {
            throw new IllegalStateException("Batch " + batchId + " is " + status.getWireValue() + " and cannot be paused");
        }
        store.writeBatchStatus(batchId, BatchStatus.PAUSED);
        log.info("Batch {} marked paused (no active run)", batchId);
    }

    public BatchHandle resume(String batchId) {
        return resume(batchId, BatchProgressObserver.NONE);
    }

    /**
     * Continues a paused, failed or interrupted batch with its remaining pending items. In-flight
     * items are reconciled first; the resume is refused while any of them stays unresolved.
     *
     * @throws UnreconciledBatchException if an in-flight transaction cannot be settled yet
     */
    public BatchHandle resume(String batchId, BatchProgressObserver observer) {
        if (activeRuns.containsKey(batchId)) {
            throw new IllegalStateException("Batch " + batchId + " is already running");
        }
        BatchStatus status = require(batchId).batch().getStatus();
        if (status == BatchStatus.VALIDATED) {
            return start(batchId, observer);
        }
        if (status != BatchStatus.PAUSED && status != BatchStatus.FAILED && status != BatchStatus.RUNNING) {
            throw new IllegalStateException("Batch " + batchId + " is " + status.getWireValue() + " and cannot be resumed");
        }
        List<Integer> unresolved = reconciler.reconcile(batchId);
        if (!unresolved.isEmpty()) {
            throw new UnreconciledBatchException(batchId, unresolved);
        }
        if (status == BatchStatus.FAILED && store.listPending(batchId).isEmpty()) {
            throw new IllegalStateException("Batch " + batchId + " has no pending items to retry");
        }
        return start(batchId, observer);
    }

    /**
     * Cancels the batch. An active run stops at the next item boundary; an idle batch is
     * marked failed immediately.
     */
    public void cancel(String batchId) {
        BatchHandle handle = activeRuns.get(batchId);
        if (handle != null) {
            handle.cancel();
            log.info("Cancel requested for batch {}", batchId);
            return;
        }
        BatchStatus status = require(batchId).batch().getStatus();
        if (status.isHalted()) {
            throw new IllegalStateException("Batch " + batchId + " is already " + status.getWireValue());
        }
        store.writeBatchStatus(batchId, BatchStatus.FAILED, BatchCancelledException.REASON);
        log.info("Batch {} cancelled while {}", batchId, status.getWireValue());
    }

    public List<Integer> reconcile(String batchId) {
        if (activeRuns.containsKey(batchId)) {
            throw new IllegalStateException("Batch " + batchId + " is running");
        }
        return reconciler.reconcile(batchId);
    }

    public BatchReport report(String batchId) {
        return BatchReport.from(require(batchId));
    }

    public Optional<Batch> findBatch(String batchId) {
        return store.read(batchId).map(BatchState::batch);
    }

    public List<Batch> recentBatches(String account, int limit) {
        return store.findBySigner(account, limit).stream().map(BatchState::batch).toList();
    }

    /**
     * Batches of the account that still have work left: not yet started, running, paused,
     * or failed with pending items.
     */
    public List<Batch> resumableBatches(String account) {
        return store.findBySigner(account, Integer.MAX_VALUE).stream()
            .filter(this::hasWorkLeft)
            .map(BatchState::batch)
            .toList();
    }

    public boolean delete(String batchId) {
        if (activeRuns.containsKey(batchId)) {
            throw new IllegalStateException("Batch " + batchId + " is running");
        }
        boolean deleted = store.delete(batchId);
        if (deleted) {
            log.info("Batch {} deleted", batchId);
        }
        return deleted;
    }

    public boolean isActive(String batchId) {
        return activeRuns.containsKey(batchId);
    }

    private boolean hasWorkLeft(BatchState state) {
        BatchStatus status = state.batch().getStatus();
        return switch (status) {
            case VALIDATED, RUNNING, PAUSED -> true;
            case FAILED -> !state.withStatus(ItemStatus.PENDING).isEmpty()
                || !state.withStatus(ItemStatus.IN_FLIGHT).isEmpty();
            case DRAFT, COMPLETED -> false;
        };
    }

    private BatchHandle start(String batchId, BatchProgressObserver observer) {
        BatchHandle handle = new BatchHandle(batchId);
        if (activeRuns.putIfAbsent(batchId, handle) != null) {
            throw new IllegalStateException("Batch " + batchId + " is already running");
        }
        BatchProgressObserver events = CompositeProgressObserver.of(loggingObserver, webhookObserver, observer);
        try {
            runExecutor.execute(() -> runToEnd(handle, events));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(batchId, handle);
            throw new IllegalStateException("Unable to start batch " + batchId + ": " + e.getMessage(), e);
        }
        return handle;
    }

    private void runToEnd(BatchHandle handle, BatchProgressObserver events) {
        BatchReport report;
        try {
            report = sequentialExecutor.run(handle.batchId(), handle, events);
        } catch (RuntimeException e) {
            log.error("Batch {} run ended unexpectedly", handle.batchId(), e);
            activeRuns.remove(handle.batchId(), handle);
            handle.fail(e);
            return;
        }
        activeRuns.remove(handle.batchId(), handle);
        handle.complete(report);
    }

    private static void requireRunnableLayout(Batch batch) {
        List<OperationItem> items = batch.getItems();
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Batch " + batch.getBatchId() + " has no items");
        }
        if (batch.getPlanLimit() < 1 || items.size() > batch.getPlanLimit()) {
            throw new IllegalArgumentException("Batch " + batch.getBatchId() + " has " + items.size()
                + " item(s), over its plan limit of " + batch.getPlanLimit());
        }
        for (int i = 0; i < items.size(); i++) {
            OperationItem item = items.get(i);
            if (item == null || item.index() != i) {
                throw new IllegalArgumentException("Batch " + batch.getBatchId() + " item at position " + i
                    + " is not indexed " + i);
            }
        }
    }

    private BatchState require(String batchId) {
        return store.read(batchId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown batch: " + batchId));
    }
}
