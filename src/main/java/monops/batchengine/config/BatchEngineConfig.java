package monops.batchengine.config;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.web3j.crypto.exception.CipherException;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.WalletUtils;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.exception.SignerUnavailableException;
import monops.batchengine.service.chain.ChainQuery;
import monops.batchengine.service.chain.OperationCallEncoder;
import monops.batchengine.service.chain.SignedTransaction;
import monops.batchengine.service.chain.Signer;
import monops.batchengine.service.chain.Web3jChainQuery;
import monops.batchengine.service.chain.Web3jTransactionSigner;
import monops.batchengine.service.persistence.BatchStateStore;
import monops.batchengine.service.persistence.FileBatchStateStore;
import monops.batchengine.service.persistence.InMemoryBatchStateStore;
import monops.batchengine.service.persistence.JdbcBatchStateStore;
import monops.batchengine.util.LogSanitizer;

/**
 * Wires the engine's collaborators: RPC client, chain reads, signer, batch store and the
 * worker pool that runs batches.
 */
@Configuration
@Slf4j
public class BatchEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties chainProperties) {
        log.info("Using RPC endpoint {}", chainProperties.getRpcUrl());
        return Web3j.build(new HttpService(chainProperties.getRpcUrl()));
    }

    @Bean
    public ChainQuery chainQuery(Web3j web3j, ChainProperties chainProperties, OperationCallEncoder encoder) {
        return new Web3jChainQuery(web3j, chainProperties, encoder);
    }

    /**
     * Signs with a local keystore when {@code signer.keystore.path} is set. Without one, every
     * signing attempt fails as signer-unavailable so batches halt instead of running unsigned.
     */
    @Bean
    public Signer signer(
        Web3j web3j,
        ChainProperties chainProperties,
        OperationCallEncoder encoder,
        @Value("${signer.keystore.path:}") String keystorePath,
        @Value("${signer.keystore.password:}") String keystorePassword
    ) {
        if (keystorePath == null || keystorePath.isBlank()) {
            log.warn("No signer keystore configured; batch execution is disabled");
            return new Signer() {
                @Override
                public SignedTransaction sign(OperationItem item, String signerAccount) {
                    throw new SignerUnavailableException("no signer configured");
                }

                @Override
                public void broadcast(SignedTransaction transaction) {
                    throw new SignerUnavailableException("no signer configured");
                }
            };
        }
        Credentials credentials;
        try {
            credentials = WalletUtils.loadCredentials(keystorePassword, keystorePath);
        } catch (IOException | CipherException e) {
            throw new IllegalStateException("Unable to load signer keystore: " + LogSanitizer.sanitize(e.getMessage()), e);
        }
        log.info("Signer loaded for {}", LogSanitizer.maskAddress(credentials.getAddress()));
        return new Web3jTransactionSigner(web3j, credentials, chainProperties.getChainId(), chainProperties, encoder);
    }

    @Bean
    public BatchStateStore batchStateStore(
        Clock clock,
        @Value("${batch.store.type:memory}") String storeType,
        @Value("${batch.store.file.directory:./data/batches}") String directory,
        @Value("${batch.store.jdbc.url:}") String jdbcUrl,
        @Value("${batch.store.jdbc.username:}") String jdbcUser,
        @Value("${batch.store.jdbc.password:}") String jdbcPassword
    ) {
        String type = storeType == null ? "memory" : storeType.trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "file" -> {
                FileBatchStateStore store = new FileBatchStateStore(Paths.get(directory), clock);
                store.init();
                log.info("Batch store: file ({})", directory);
                return store;
            }
            case "jdbc" -> {
                if (jdbcUrl == null || jdbcUrl.isBlank()) {
                    throw new IllegalStateException("batch.store.jdbc.url is required for the jdbc batch store");
                }
                DriverManagerDataSource dataSource = new DriverManagerDataSource(jdbcUrl, jdbcUser, jdbcPassword);
                log.info("Batch store: jdbc");
                return new JdbcBatchStateStore(new JdbcTemplate(dataSource), clock);
            }
            case "memory" -> {
                log.info("Batch store: memory (batches are lost on restart)");
                return new InMemoryBatchStateStore(clock);
            }
            default -> throw new IllegalStateException("Unknown batch.store.type: " + LogSanitizer.sanitize(storeType));
        }
    }

    @Bean(name = "batchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService batchRunExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "batch-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
