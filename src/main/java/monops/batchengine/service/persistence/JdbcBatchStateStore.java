package monops.batchengine.service.persistence;

import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.exception.BatchStoreException;
import monops.batchengine.util.LogSanitizer;

/**
 * Relational store over the {@code batches} and {@code batch_items} tables
 * (see {@code db/batch-schema.sql}). Item records are upserted with MySQL syntax.
 */
@Slf4j
public class JdbcBatchStateStore implements BatchStateStore {

    private static final TypeReference<List<OperationItem>> ITEM_LIST = new TypeReference<>() { };

    private static final String UPSERT_ITEM = """
        INSERT INTO batch_items (
            batch_id, item_index, status, tx_hash, error, skip_reason,
            gas_used, block_number, attempted_at, completed_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON DUPLICATE KEY UPDATE
            status = VALUES(status),
            tx_hash = VALUES(tx_hash),
            error = VALUES(error),
            skip_reason = VALUES(skip_reason),
            gas_used = VALUES(gas_used),
            block_number = VALUES(block_number),
            attempted_at = VALUES(attempted_at),
            completed_at = VALUES(completed_at)
        """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JdbcBatchStateStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public void create(BatchState initial) {
        BatchStateStore.requireConsistent(initial);
        Batch batch = initial.batch();
        try {
            jdbcTemplate.update(
                """
                INSERT INTO batches (
                    batch_id, signer_account, status, items_json, item_count, discarded_count,
                    plan_limit, failure_reason, created_at, updated_at, completed_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                batch.getBatchId(),
                batch.getSignerAccount(),
                batch.getStatus().getWireValue(),
                writeItems(batch.getItems()),
                batch.getItems().size(),
                batch.getDiscardedCount(),
                batch.getPlanLimit(),
                batch.getFailureReason(),
                timestamp(batch.getCreatedAt()),
                timestamp(batch.getUpdatedAt()),
                timestamp(batch.getCompletedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Batch already exists: " + batch.getBatchId(), e);
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to create batch " + batch.getBatchId(), e);
        }
        try {
            List<Object[]> rows = new ArrayList<>();
            for (ItemExecutionRecord record : initial.records()) {
                rows.add(itemParams(batch.getBatchId(), record));
            }
            jdbcTemplate.batchUpdate(UPSERT_ITEM, rows);
        } catch (DataAccessException e) {
            deleteQuietly(batch.getBatchId());
            throw new BatchStoreException("Failed to create item records for batch " + batch.getBatchId(), e);
        }
    }

    @Override
    public Optional<BatchState> read(String batchId) {
        try {
            Optional<Batch> batch = jdbcTemplate.query(
                "SELECT * FROM batches WHERE batch_id = ? LIMIT 1",
                this::mapBatch,
                batchId
            ).stream().findFirst();
            if (batch.isEmpty()) {
                return Optional.empty();
            }
            List<ItemExecutionRecord> records = jdbcTemplate.query(
                "SELECT * FROM batch_items WHERE batch_id = ? ORDER BY item_index",
                this::mapRecord,
                batchId
            );
            return Optional.of(new BatchState(batch.get(), records));
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to read batch " + batchId, e);
        }
    }

    @Override
    public void writeItemRecord(String batchId, int index, ItemExecutionRecord record) {
        if (record.getIndex() != index) {
            throw new IllegalArgumentException("Record index " + record.getIndex() + " does not match " + index);
        }
        try {
            List<Integer> counts = jdbcTemplate.queryForList(
                "SELECT item_count FROM batches WHERE batch_id = ?", Integer.class, batchId);
            if (counts.isEmpty()) {
                throw new IllegalArgumentException("Unknown batch: " + batchId);
            }
            if (index < 0 || index >= counts.get(0)) {
                throw new IllegalArgumentException("Batch " + batchId + " has no item " + index);
            }
            jdbcTemplate.update(UPSERT_ITEM, itemParams(batchId, record));
            jdbcTemplate.update("UPDATE batches SET updated_at = ? WHERE batch_id = ?",
                timestamp(clock.instant()), batchId);
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to write item " + index + " of batch " + batchId, e);
        }
    }

    @Override
    public void writeBatchStatus(String batchId, BatchStatus status, String reason) {
        Instant now = clock.instant();
        int updated;
        try {
            updated = jdbcTemplate.update(
                """
                UPDATE batches
                   SET status = ?, failure_reason = ?, updated_at = ?, completed_at = ?
                 WHERE batch_id = ?
                """,
                status.getWireValue(),
                reason,
                timestamp(now),
                status.isHalted() ? timestamp(now) : null,
                batchId
            );
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to write status of batch " + batchId, e);
        }
        if (updated == 0) {
            throw new IllegalArgumentException("Unknown batch: " + batchId);
        }
    }

    @Override
    public List<Integer> listPending(String batchId) {
        try {
            return jdbcTemplate.queryForList(
                "SELECT item_index FROM batch_items WHERE batch_id = ? AND status = ? ORDER BY item_index",
                Integer.class,
                batchId,
                ItemStatus.PENDING.getWireValue()
            );
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to list pending items of batch " + batchId, e);
        }
    }

    @Override
    public List<BatchState> findBySigner(String signerAccount, int limit) {
        if (signerAccount == null || limit <= 0) {
            return List.of();
        }
        List<String> ids;
        try {
            ids = jdbcTemplate.queryForList(
                "SELECT batch_id FROM batches WHERE signer_account = ? ORDER BY created_at DESC LIMIT ?",
                String.class,
                signerAccount.toLowerCase(Locale.ROOT),
                limit
            );
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to list batches", e);
        }
        List<BatchState> states = new ArrayList<>();
        for (String id : ids) {
            read(id).ifPresent(states::add);
        }
        return states;
    }

    @Override
    public boolean delete(String batchId) {
        try {
            jdbcTemplate.update("DELETE FROM batch_items WHERE batch_id = ?", batchId);
            return jdbcTemplate.update("DELETE FROM batches WHERE batch_id = ?", batchId) > 0;
        } catch (DataAccessException e) {
            throw new BatchStoreException("Failed to delete batch " + batchId, e);
        }
    }

    private Object[] itemParams(String batchId, ItemExecutionRecord record) {
        return new Object[] {
            batchId,
            record.getIndex(),
            record.getStatus().getWireValue(),
            record.getTxHash(),
            record.getError(),
            record.getSkipReason(),
            record.getGasUsed() != null ? record.getGasUsed().toString() : null,
            record.getBlockNumber(),
            timestamp(record.getAttemptedAt()),
            timestamp(record.getCompletedAt())
        };
    }

    private Batch mapBatch(ResultSet rs, int rowNum) throws SQLException {
        Batch batch = new Batch();
        batch.setBatchId(rs.getString("batch_id"));
        batch.setSignerAccount(rs.getString("signer_account"));
        batch.setStatus(BatchStatus.fromWireValue(rs.getString("status")));
        batch.setItems(readItems(rs.getString("items_json")));
        batch.setDiscardedCount(rs.getInt("discarded_count"));
        batch.setPlanLimit(rs.getInt("plan_limit"));
        batch.setFailureReason(rs.getString("failure_reason"));
        batch.setCreatedAt(instant(rs.getTimestamp("created_at")));
        batch.setUpdatedAt(instant(rs.getTimestamp("updated_at")));
        batch.setCompletedAt(instant(rs.getTimestamp("completed_at")));
        return batch;
    }

    private ItemExecutionRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        ItemExecutionRecord record = new ItemExecutionRecord();
        record.setIndex(rs.getInt("item_index"));
        record.setStatus(ItemStatus.fromWireValue(rs.getString("status")));
        record.setTxHash(rs.getString("tx_hash"));
        record.setError(rs.getString("error"));
        record.setSkipReason(rs.getString("skip_reason"));
        String gasUsed = rs.getString("gas_used");
        record.setGasUsed(gasUsed != null ? new BigInteger(gasUsed) : null);
        long blockNumber = rs.getLong("block_number");
        record.setBlockNumber(rs.wasNull() ? null : blockNumber);
        record.setAttemptedAt(instant(rs.getTimestamp("attempted_at")));
        record.setCompletedAt(instant(rs.getTimestamp("completed_at")));
        return record;
    }

    private String writeItems(List<OperationItem> items) {
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new BatchStoreException("Failed to serialize batch items", e);
        }
    }

    private List<OperationItem> readItems(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ITEM_LIST);
        } catch (JsonProcessingException e) {
            throw new BatchStoreException("Failed to parse batch items", e);
        }
    }

    private void deleteQuietly(String batchId) {
        try {
            delete(batchId);
        } catch (BatchStoreException e) {
            log.warn("Cleanup of partially created batch {} failed: {}", batchId, LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
