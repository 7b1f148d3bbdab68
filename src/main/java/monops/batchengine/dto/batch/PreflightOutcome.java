package monops.batchengine.dto.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Items accepted under the plan limit, the number discarded by truncation, and the report
 * produced for the accepted items. Missing items stay in place as nulls so their positions
 * line up with the report.
 */
public record PreflightOutcome(
    List<OperationItem> acceptedItems,
    int discardedCount,
    int planLimit,
    PreflightReport report
) {

    public PreflightOutcome {
        acceptedItems = Collections.unmodifiableList(new ArrayList<>(acceptedItems));
    }

    public boolean truncated() {
        return discardedCount > 0;
    }
}
