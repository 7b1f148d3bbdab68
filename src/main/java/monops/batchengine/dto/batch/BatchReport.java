package monops.batchengine.dto.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Auditable summary of a batch: what succeeded, what failed and why, what was skipped,
 * and what was never attempted.
 */
public record BatchReport(
    String batchId,
    BatchStatus status,
    String failureReason,
    int total,
    SortedMap<Integer, String> succeeded,
    SortedMap<Integer, String> failed,
    SortedMap<Integer, String> skipped,
    List<Integer> inFlight,
    List<Integer> pending
) {

    public static BatchReport from(BatchState state) {
        SortedMap<Integer, String> succeeded = new TreeMap<>();
        SortedMap<Integer, String> failed = new TreeMap<>();
        SortedMap<Integer, String> skipped = new TreeMap<>();
        List<Integer> inFlight = new ArrayList<>();
        List<Integer> pending = new ArrayList<>();
        for (ItemExecutionRecord record : state.records()) {
            switch (record.getStatus()) {
                case SUCCEEDED -> succeeded.put(record.getIndex(), record.getTxHash());
                case FAILED -> failed.put(record.getIndex(), record.getError());
                case SKIPPED -> skipped.put(record.getIndex(), record.getSkipReason());
                case IN_FLIGHT -> inFlight.add(record.getIndex());
                case PENDING -> pending.add(record.getIndex());
            }
        }
        Batch batch = state.batch();
        return new BatchReport(
            batch.getBatchId(),
            batch.getStatus(),
            batch.getFailureReason(),
            state.records().size(),
            succeeded,
            failed,
            skipped,
            List.copyOf(inFlight),
            List.copyOf(pending)
        );
    }

    public int accountedFor() {
        return succeeded.size() + failed.size() + skipped.size() + inFlight.size() + pending.size();
    }
}
