package monops.batchengine.dto.batch;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Aggregate unit of work: an ordered, size-capped list of operation items signed by one account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Batch {
    private String batchId;
    private String signerAccount;
    private List<OperationItem> items = List.of();
    private BatchStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private String failureReason;
    private int discardedCount;
    private int planLimit;

    public Batch() {
    }

    public static Batch draft(String signerAccount, List<OperationItem> items, int discardedCount,
                              int planLimit, Instant now) {
        Batch batch = new Batch();
        batch.batchId = UUID.randomUUID().toString();
        batch.signerAccount = signerAccount == null ? null : signerAccount.toLowerCase(Locale.ROOT);
        batch.items = List.copyOf(items);
        batch.status = BatchStatus.DRAFT;
        batch.createdAt = now;
        batch.updatedAt = now;
        batch.discardedCount = discardedCount;
        batch.planLimit = planLimit;
        return batch;
    }

    public Batch copy() {
        Batch copy = new Batch();
        copy.batchId = batchId;
        copy.signerAccount = signerAccount;
        copy.items = items;
        copy.status = status;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.completedAt = completedAt;
        copy.failureReason = failureReason;
        copy.discardedCount = discardedCount;
        copy.planLimit = planLimit;
        return copy;
    }

    public String getBatchId() {
        return batchId;
    }

    public void setBatchId(String batchId) {
        this.batchId = batchId;
    }

    public String getSignerAccount() {
        return signerAccount;
    }

    public void setSignerAccount(String signerAccount) {
        this.signerAccount = signerAccount;
    }

    public List<OperationItem> getItems() {
        return items;
    }

    public void setItems(List<OperationItem> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public BatchStatus getStatus() {
        return status;
    }

    public void setStatus(BatchStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public int getDiscardedCount() {
        return discardedCount;
    }

    public void setDiscardedCount(int discardedCount) {
        this.discardedCount = discardedCount;
    }

    public int getPlanLimit() {
        return planLimit;
    }

    public void setPlanLimit(int planLimit) {
        this.planLimit = planLimit;
    }
}
