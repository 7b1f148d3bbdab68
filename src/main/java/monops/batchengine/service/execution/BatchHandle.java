package monops.batchengine.service.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import monops.batchengine.dto.batch.BatchReport;

/**
 * Caller's grip on one run of a batch. Pause and cancel are requests: the run honours them
 * at the next item boundary, never in the middle of a submission.
 */
public class BatchHandle {

    private final String batchId;
    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<BatchReport> completion = new CompletableFuture<>();

    public BatchHandle(String batchId) {
        this.batchId = batchId;
    }

    public String batchId() {
        return batchId;
    }

    public void pause() {
        pauseRequested.set(true);
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean pauseRequested() {
        return pauseRequested.get();
    }

    public boolean cancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Completes with the report once the run halts (completed, paused or failed). Completes
     * exceptionally only when the run could not start or hit an unexpected error.
     */
    public CompletableFuture<BatchReport> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public void complete(BatchReport report) {
        completion.complete(report);
    }

    public void fail(Throwable error) {
        completion.completeExceptionally(error);
    }
}
