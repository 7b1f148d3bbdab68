package monops.batchengine.dto.batch;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time copy of a stored batch and its item records, records ordered by index.
 */
public record BatchState(Batch batch, List<ItemExecutionRecord> records) {

    public BatchState {
        records = records.stream()
            .sorted(Comparator.comparingInt(ItemExecutionRecord::getIndex))
            .toList();
    }

    public Optional<ItemExecutionRecord> record(int index) {
        return records.stream().filter(r -> r.getIndex() == index).findFirst();
    }

    public List<ItemExecutionRecord> withStatus(ItemStatus status) {
        return records.stream().filter(r -> r.getStatus() == status).toList();
    }

    public boolean allTerminal() {
        return records.stream().allMatch(ItemExecutionRecord::isTerminal);
    }

    public BatchState copy() {
        return new BatchState(batch.copy(), records.stream().map(ItemExecutionRecord::copy).toList());
    }
}
