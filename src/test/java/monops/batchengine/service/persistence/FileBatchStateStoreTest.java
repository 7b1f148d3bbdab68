package monops.batchengine.service.persistence;

import static monops.batchengine.BatchFixtures.CLOCK;
import static monops.batchengine.BatchFixtures.NOW;
import static monops.batchengine.BatchFixtures.SIGNER;
import static monops.batchengine.BatchFixtures.nftTransfers;
import static monops.batchengine.BatchFixtures.validatedBatch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import monops.batchengine.dto.batch.Batch;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.dto.batch.BatchStatus;
import monops.batchengine.dto.batch.ItemExecutionRecord;
import monops.batchengine.dto.batch.ItemStatus;
import monops.batchengine.dto.batch.OperationKind;
import monops.batchengine.dto.batch.TokenStandard;

class FileBatchStateStoreTest {

    @TempDir
    Path directory;

    private FileBatchStateStore newStore() {
        FileBatchStateStore store = new FileBatchStateStore(directory, CLOCK);
        store.init();
        return store;
    }

    @Test
    void batchSurvivesRestart() {
        FileBatchStateStore store = newStore();
        Batch batch = validatedBatch(nftTransfers(3));
        store.create(batch);
        ItemExecutionRecord record = ItemExecutionRecord.pending(0);
        record.markInFlight(NOW);
        record.recordTxHash("0xabc");
        record.markSucceeded(BigInteger.valueOf(50_000), 12L, NOW);
        store.writeItemRecord(batch.getBatchId(), 0, record);
        store.writeBatchStatus(batch.getBatchId(), BatchStatus.PAUSED);

        BatchState reloaded = newStore().read(batch.getBatchId()).orElseThrow();

        assertThat(reloaded.batch().getStatus()).isEqualTo(BatchStatus.PAUSED);
        assertThat(reloaded.batch().getSignerAccount()).isEqualTo(SIGNER);
        assertThat(reloaded.batch().getCreatedAt()).isEqualTo(NOW);
        assertThat(reloaded.batch().getItems()).hasSize(3);
        assertThat(reloaded.batch().getItems().get(1).kind()).isEqualTo(OperationKind.NFT_TRANSFER);
        assertThat(reloaded.batch().getItems().get(1).assetRef().standard()).isEqualTo(TokenStandard.ERC721);
        assertThat(reloaded.batch().getItems().get(1).assetRef().tokenId()).isEqualTo(BigInteger.TWO);
        ItemExecutionRecord first = reloaded.record(0).orElseThrow();
        assertThat(first.getStatus()).isEqualTo(ItemStatus.SUCCEEDED);
        assertThat(first.getTxHash()).isEqualTo("0xabc");
        assertThat(first.getGasUsed()).isEqualTo(BigInteger.valueOf(50_000));
        assertThat(first.getBlockNumber()).isEqualTo(12L);
        assertThat(reloaded.record(1).orElseThrow().getStatus()).isEqualTo(ItemStatus.PENDING);
    }

    @Test
    void writesOneDocumentPerBatchWithoutTempLeftovers() throws IOException {
        FileBatchStateStore store = newStore();
        Batch batch = validatedBatch(nftTransfers(1));
        store.create(batch);

        try (var files = Files.list(directory)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .containsExactly(batch.getBatchId() + ".json");
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void documentsAreOwnerOnly() throws IOException {
        FileBatchStateStore store = newStore();
        Batch batch = validatedBatch(nftTransfers(1));
        store.create(batch);

        assertThat(Files.getPosixFilePermissions(directory.resolve(batch.getBatchId() + ".json")))
            .containsExactlyInAnyOrder(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);
    }

    @Test
    void deleteRemovesDocument() {
        FileBatchStateStore store = newStore();
        Batch batch = validatedBatch(nftTransfers(1));
        store.create(batch);

        store.delete(batch.getBatchId());

        assertThat(Files.exists(directory.resolve(batch.getBatchId() + ".json"))).isFalse();
        assertThat(newStore().read(batch.getBatchId())).isEmpty();
    }

    @Test
    void unreadableDocumentIsSkippedOnLoad() throws IOException {
        Files.writeString(directory.resolve("broken.json"), "{not json");
        FileBatchStateStore store = newStore();

        assertThat(store.findBySigner(SIGNER, 10)).isEmpty();
    }

    @Test
    void rejectsBatchIdsThatEscapeTheDirectory() {
        FileBatchStateStore store = newStore();
        Batch batch = validatedBatch(nftTransfers(1));
        batch.setBatchId("../escape");

        assertThatThrownBy(() -> store.create(batch)).isInstanceOf(IllegalArgumentException.class);
    }
}
