package monops.batchengine.service.chain;

import java.math.BigInteger;
import java.util.Optional;

import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.dto.batch.OperationKind;

/**
 * Read-only access to chain state used by preflight, execution and reconciliation.
 */
public interface ChainQuery {

    CostEstimate estimateCost(OperationKind kind);

    /**
     * Simulates the item's transaction from {@code from} and returns the gas it would use.
     *
     * @throws monops.batchengine.exception.TransactionRevertedException when the call would revert
     */
    BigInteger estimateGas(OperationItem item, String from);

    /**
     * @throws IllegalStateException when the contract does not answer {@code symbol()} and {@code decimals()}
     */
    TokenMetadata tokenMetadata(String token);

    /**
     * Blocks until the transaction is mined or the polling window is exhausted.
     *
     * @throws monops.batchengine.exception.ConfirmationTimeoutException when no receipt appeared
     * @throws monops.batchengine.exception.ChainUnavailableException when the endpoint is unreachable
     */
    ConfirmationOutcome getConfirmation(String txHash);

    /**
     * Single receipt lookup without waiting; empty while the transaction is unknown or pending.
     */
    Optional<ConfirmationOutcome> lookupConfirmation(String txHash);

    BigInteger nativeBalance(String account);

    BigInteger tokenBalance(String token, String account);

    String nftOwner(String collection, BigInteger tokenId);

    BigInteger nftBalance(String collection, BigInteger tokenId, String account);
}
