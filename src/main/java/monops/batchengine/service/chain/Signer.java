package monops.batchengine.service.chain;

import monops.batchengine.dto.batch.OperationItem;

/**
 * Signs and broadcasts operations on behalf of the batch owner. Keys never pass through
 * the engine; implementations wrap whatever custody the caller provides.
 *
 * Signing and broadcasting are separate steps so the transaction hash can be stored before
 * the node ever sees the transaction.
 */
public interface Signer {

    /**
     * @throws monops.batchengine.exception.SignerRejectedException when this item was refused
     * @throws monops.batchengine.exception.SignerUnavailableException when the signer is gone
     */
    SignedTransaction sign(OperationItem item, String signerAccount);

    /**
     * @throws monops.batchengine.exception.SignerRejectedException when the node refused the transaction
     * @throws monops.batchengine.exception.SubmissionTimeoutException when the node did not answer in time
     * @throws monops.batchengine.exception.SignerUnavailableException when the connection is unusable
     */
    void broadcast(SignedTransaction transaction);

    /**
     * @return the transaction hash of the broadcast transaction
     */
    default String submit(OperationItem item, String signerAccount) {
        SignedTransaction transaction = sign(item, signerAccount);
        broadcast(transaction);
        return transaction.txHash();
    }
}
