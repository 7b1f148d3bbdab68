package monops.batchengine.dto.batch;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Advisory result of a preflight pass. Balances and ownership may change before execution,
 * so the report is never persisted as authoritative state.
 */
public record PreflightReport(
    boolean overallValid,
    SortedMap<Integer, ItemValidation> perItem,
    List<String> batchReasons,
    BigInteger estimatedGasTotal,
    BigInteger estimatedCostTotal
) {

    public PreflightReport {
        perItem = Collections.unmodifiableSortedMap(new TreeMap<>(perItem));
        batchReasons = List.copyOf(batchReasons);
    }

    public static PreflightReport of(Map<Integer, ItemValidation> perItem, List<String> batchReasons,
                                     BigInteger estimatedGasTotal, BigInteger estimatedCostTotal) {
        boolean valid = batchReasons.isEmpty()
            && !perItem.isEmpty()
            && perItem.values().stream().allMatch(ItemValidation::valid);
        return new PreflightReport(valid, new TreeMap<>(perItem), batchReasons, estimatedGasTotal, estimatedCostTotal);
    }

    public static PreflightReport rejected(String batchReason) {
        return new PreflightReport(false, new TreeMap<>(), List.of(batchReason), BigInteger.ZERO, BigInteger.ZERO);
    }

    public ItemValidation item(int index) {
        return perItem.get(index);
    }

    public List<Integer> invalidIndices() {
        return perItem.values().stream()
            .filter(v -> !v.valid())
            .map(ItemValidation::index)
            .toList();
    }
}
