package monops.batchengine.service.persistence;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;

/**
 * Map-backed store. Every read and write goes through a deep copy so callers never share
 * mutable state with the store. Lost on restart; {@link FileBatchStateStore} adds durability
 * on top of the same cache.
 */
@Slf4j
public class InMemoryBatchStateStore implements BatchStateStore {

    private final Map<String, BatchState> states = new ConcurrentHashMap<>();
    protected final Clock clock;

    public InMemoryBatchStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(BatchState initial) {
        String batchId = initial.batch().getBatchId();
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("batchId is required");
        }
        BatchStateStore.requireConsistent(initial);
        BatchState copy = initial.copy();
        synchronized (states) {
            if (states.containsKey(batchId)) {
                throw new IllegalStateException("Batch already exists: " + batchId);
            }
            persist(copy);
            states.put(batchId, copy);
        }
        log.debug("Stored batch {} with {} records", batchId, copy.records().size());
    }

    @Override
    public Optional<BatchState> read(String batchId) {
        BatchState state = states.get(batchId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    @Override
    public void writeItemRecord(String batchId, int index, ItemExecutionRecord record) {
        if (record.getIndex() != index) {
            throw new IllegalArgumentException("Record index " + record.getIndex() + " does not match " + index);
        }
        synchronized (states) {
            BatchState current = require(batchId);
            if (current.record(index).isEmpty()) {
                throw new IllegalArgumentException("Batch " + batchId + " has no item " + index);
            }
            List<ItemExecutionRecord> records = current.records().stream()
                .map(r -> r.getIndex() == index ? record.copy() : r.copy())
                .toList();
            Batch batch = current.batch().copy();
            batch.setUpdatedAt(clock.instant());
            BatchState updated = new BatchState(batch, records);
            persist(updated);
            states.put(batchId, updated);
        }
    }

    @Override
    public void writeBatchStatus(String batchId, BatchStatus status, String reason) {
        synchronized (states) {
            BatchState current = require(batchId).copy();
            applyStatus(current.batch(), status, reason, clock);
            persist(current);
            states.put(batchId, current);
        }
    }

    @Override
    public List<Integer> listPending(String batchId) {
        BatchState state = states.get(batchId);
        if (state == null) {
            return List.of();
        }
        return state.withStatus(ItemStatus.PENDING).stream()
            .map(ItemExecutionRecord::getIndex)
            .toList();
    }

    @Override
    public List<BatchState> findBySigner(String signerAccount, int limit) {
        if (signerAccount == null || limit <= 0) {
            return List.of();
        }
        String account = signerAccount.toLowerCase(Locale.ROOT);
        return states.values().stream()
            .filter(s -> account.equals(s.batch().getSignerAccount()))
            .sorted(Comparator.comparing((BatchState s) -> s.batch().getCreatedAt()).reversed())
            .limit(limit)
            .map(BatchState::copy)
            .toList();
    }

    @Override
    public boolean delete(String batchId) {
        synchronized (states) {
            if (!states.containsKey(batchId)) {
                return false;
            }
            remove(batchId);
            states.remove(batchId);
            return true;
        }
    }

    /**
     * Hook for durable subclasses; called before the cache is updated so a failed write
     * leaves the cache untouched.
     */
    protected void persist(BatchState state) {
    }

    protected void remove(String batchId) {
    }

    protected void load(BatchState state) {
        states.put(state.batch().getBatchId(), state);
    }

    private BatchState require(String batchId) {
        BatchState state = states.get(batchId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown batch: " + batchId);
        }
        return state;
    }

    static void applyStatus(Batch batch, BatchStatus status, String reason, Clock clock) {
        var now = clock.instant();
        batch.setStatus(status);
        batch.setUpdatedAt(now);
        batch.setFailureReason(reason);
        if (status.isHalted()) {
            batch.setCompletedAt(now);
        } else {
            batch.setCompletedAt(null);
        }
    }
}
