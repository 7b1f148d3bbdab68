package monops.batchengine.dto.batch;

import java.math.BigInteger;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Execution state of one item, keyed by (batchId, index). The mark* methods are the only
 * legal way to move between statuses; setters exist for rehydration from storage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ItemExecutionRecord {
    private int index;
    private ItemStatus status = ItemStatus.PENDING;
    private String txHash;
    private String error;
    private String skipReason;
    private BigInteger gasUsed;
    private Long blockNumber;
    private Instant attemptedAt;
    private Instant completedAt;

    public ItemExecutionRecord() {
    }

    public static ItemExecutionRecord pending(int index) {
        ItemExecutionRecord record = new ItemExecutionRecord();
        record.index = index;
        return record;
    }

    public void markInFlight(Instant at) {
        transitionTo(ItemStatus.IN_FLIGHT);
        this.attemptedAt = at;
    }

    public void recordTxHash(String hash) {
        if (status != ItemStatus.IN_FLIGHT) {
            throw new IllegalStateException("Item " + index + " is " + status + "; tx hash only recorded while in flight");
        }
        this.txHash = hash;
    }

    public void markSucceeded(BigInteger gas, Long block, Instant at) {
        transitionTo(ItemStatus.SUCCEEDED);
        this.gasUsed = gas;
        this.blockNumber = block;
        this.completedAt = at;
    }

    public void markFailed(String reason, Instant at) {
        transitionTo(ItemStatus.FAILED);
        this.error = reason;
        this.completedAt = at;
    }

    public void markSkipped(String reason, Instant at) {
        transitionTo(ItemStatus.SKIPPED);
        this.skipReason = reason;
        this.completedAt = at;
    }

    public void revertToPending() {
        if (txHash != null) {
            throw new IllegalStateException("Item " + index + " has tx hash " + txHash + " and cannot return to pending");
        }
        transitionTo(ItemStatus.PENDING);
        this.attemptedAt = null;
    }

    private void transitionTo(ItemStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for item " + index + ": " + status + " -> " + next);
        }
        this.status = next;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ItemExecutionRecord copy() {
        ItemExecutionRecord copy = new ItemExecutionRecord();
        copy.index = index;
        copy.status = status;
        copy.txHash = txHash;
        copy.error = error;
        copy.skipReason = skipReason;
        copy.gasUsed = gasUsed;
        copy.blockNumber = blockNumber;
        copy.attemptedAt = attemptedAt;
        copy.completedAt = completedAt;
        return copy;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public void setStatus(ItemStatus status) {
        this.status = status;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public void setSkipReason(String skipReason) {
        this.skipReason = skipReason;
    }

    public BigInteger getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(BigInteger gasUsed) {
        this.gasUsed = gasUsed;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public Instant getAttemptedAt() {
        return attemptedAt;
    }

    public void setAttemptedAt(Instant attemptedAt) {
        this.attemptedAt = attemptedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
