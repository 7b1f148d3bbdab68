package monops.batchengine.service.persistence;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.BatchState;
import monops.batchengine.exception.BatchStoreException;
import monops.batchengine.util.LogSanitizer;

/**
 * File-backed store: one JSON document per batch ({@code <batchId>.json}) in the configured
 * directory. Documents are written to a temp file and moved into place so a crash never
 * leaves a half-written batch behind. Files are restricted to 0600 on POSIX systems.
 *
 * All batches are loaded into memory by {@link #init()}; reads are served from that cache.
 */
@Slf4j
public class FileBatchStateStore extends InMemoryBatchStateStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public FileBatchStateStore(Path directory, Clock clock) {
        super(clock);
        this.directory = directory;
    }

    public void init() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new BatchStoreException("Cannot create batch directory " + directory, e);
        }
        int loaded = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    load(objectMapper.readValue(file.toFile(), BatchState.class));
                    loaded++;
                } catch (IOException e) {
                    log.error("Skipping unreadable batch file {}: {}", file.getFileName(), LogSanitizer.sanitize(e.getMessage()));
                }
            }
        } catch (IOException e) {
            throw new BatchStoreException("Cannot list batch directory " + directory, e);
        }
        log.info("Loaded {} batch(es) from {}", loaded, directory);
    }

    @Override
    protected void persist(BatchState state) {
        Path target = fileFor(state.batch().getBatchId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            restrictPermissions(temp);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new BatchStoreException("Failed to write batch " + state.batch().getBatchId(), e);
        }
    }

    @Override
    protected void remove(String batchId) {
        try {
            Files.deleteIfExists(fileFor(batchId));
        } catch (IOException e) {
            throw new BatchStoreException("Failed to delete batch " + batchId, e);
        }
    }

    private Path fileFor(String batchId) {
        if (batchId == null || !batchId.matches("[A-Za-z0-9-]+")) {
            throw new IllegalArgumentException("Invalid batch id: " + LogSanitizer.sanitize(batchId));
        }
        return directory.resolve(batchId + SUFFIX);
    }

    private void restrictPermissions(Path path) throws IOException {
        try {
            if (!System.getProperty("os.name").toLowerCase().contains("win")) {
                Files.setPosixFilePermissions(path, Set.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE
                ));
            }
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported on this system");
        }
    }
}
