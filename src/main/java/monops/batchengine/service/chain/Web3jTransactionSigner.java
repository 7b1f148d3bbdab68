package monops.batchengine.service.chain;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigInteger;
import java.util.Locale;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.utils.Numeric;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.config.ChainProperties;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.exception.SignerRejectedException;
import monops.batchengine.exception.SignerUnavailableException;
import monops.batchengine.exception.SubmissionTimeoutException;
import monops.batchengine.util.EthereumAddressValidator;
import monops.batchengine.util.LogSanitizer;

/**
 * {@link Signer} holding caller-supplied web3j {@link Credentials}. Transactions are signed
 * locally against the account's pending nonce and sent raw, so the hash is fixed before the
 * node is contacted.
 */
@Slf4j
public class Web3jTransactionSigner implements Signer {

    private final Web3j web3j;
    private final Credentials credentials;
    private final long chainId;
    private final ChainProperties properties;
    private final OperationCallEncoder encoder;

    public Web3jTransactionSigner(
        Web3j web3j,
        Credentials credentials,
        long chainId,
        ChainProperties properties,
        OperationCallEncoder encoder
    ) {
        this.web3j = web3j;
        this.credentials = credentials;
        this.chainId = chainId;
        this.properties = properties;
        this.encoder = encoder;
    }

    @Override
    public SignedTransaction sign(OperationItem item, String signerAccount) {
        String from = credentials.getAddress();
        if (!EthereumAddressValidator.sameAddress(from, signerAccount)) {
            throw new SignerRejectedException("signer " + LogSanitizer.maskAddress(from)
                + " cannot sign for account " + LogSanitizer.maskAddress(signerAccount));
        }
        OperationCallEncoder.EncodedCall call = encoder.encode(item, from);
        RawTransaction raw = RawTransaction.createTransaction(
            pendingNonce(from),
            gasPrice(),
            properties.getGas().limitFor(item.kind()),
            call.to(),
            call.value(),
            call.data()
        );
        String payload = Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));
        String txHash = Hash.sha3(payload);
        log.debug("Item {} signed as {} with nonce {}", item.index(), txHash, raw.getNonce());
        return new SignedTransaction(txHash, payload);
    }

    @Override
    public void broadcast(SignedTransaction transaction) {
        EthSendTransaction response;
        try {
            response = web3j.ethSendRawTransaction(transaction.payload()).send();
        } catch (InterruptedIOException e) {
            throw new SubmissionTimeoutException(transaction.txHash(),
                "broadcast of " + transaction.txHash() + " timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SignerUnavailableException("signer unavailable: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new SignerUnavailableException("signer returned no response");
        }
        if (response.hasError()) {
            String message = response.getError().getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("already known")) {
                log.debug("Node already has {}", transaction.txHash());
                return;
            }
            throw new SignerRejectedException(message);
        }
        log.debug("Broadcast {}", transaction.txHash());
    }

    private BigInteger pendingNonce(String from) {
        EthGetTransactionCount response;
        try {
            response = web3j.ethGetTransactionCount(from, DefaultBlockParameterName.PENDING).send();
        } catch (IOException e) {
            throw new SignerUnavailableException("unable to read nonce: " + e.getMessage(), e);
        }
        if (response == null || response.hasError()) {
            throw new SignerUnavailableException("unable to read nonce"
                + (response != null ? ": " + response.getError().getMessage() : ""));
        }
        return response.getTransactionCount();
    }

    private BigInteger gasPrice() {
        try {
            EthGasPrice response = web3j.ethGasPrice().send();
            if (response != null && !response.hasError() && response.getGasPrice() != null) {
                return response.getGasPrice();
            }
        } catch (IOException e) {
            log.warn("eth_gasPrice failed, using fallback: {}", LogSanitizer.sanitize(e.getMessage()));
        }
        BigInteger fallback = properties.getGas().fallbackPriceWei();
        if (fallback == null) {
            throw new SignerUnavailableException("no gas price available");
        }
        return fallback;
    }
}
