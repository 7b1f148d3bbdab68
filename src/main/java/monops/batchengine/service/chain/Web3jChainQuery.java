package monops.batchengine.service.chain;

import java.io.IOException;
import java.math.BigInteger;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.config.ChainProperties;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.dto.batch.OperationKind;
import monops.batchengine.exception.ChainUnavailableException;
import monops.batchengine.exception.ConfirmationTimeoutException;
import monops.batchengine.exception.TransactionRevertedException;
import monops.batchengine.util.LogSanitizer;

/**
 * {@link ChainQuery} over a JSON-RPC endpoint. Connection-level failures are reported as
 * {@link ChainUnavailableException}; anything else during receipt polling counts as "not yet".
 */
@Slf4j
public class Web3jChainQuery implements ChainQuery {

    private final Web3j web3j;
    private final ChainProperties properties;
    private final OperationCallEncoder encoder;

    public Web3jChainQuery(Web3j web3j, ChainProperties properties, OperationCallEncoder encoder) {
        this.web3j = web3j;
        this.properties = properties;
        this.encoder = encoder;
    }

    @Override
    public CostEstimate estimateCost(OperationKind kind) {
        BigInteger gas = properties.getGas().limitFor(kind);
        BigInteger gasPrice = send("eth_gasPrice", web3j.ethGasPrice()).getGasPrice();
        return new CostEstimate(gas, gas.multiply(gasPrice));
    }

    @Override
    public BigInteger estimateGas(OperationItem item, String from) {
        OperationCallEncoder.EncodedCall call = encoder.encode(item, from);
        Transaction transaction = Transaction.createFunctionCallTransaction(
            from, null, null, null, call.to(), call.value(), call.data().isEmpty() ? null : call.data());
        EthEstimateGas response;
        try {
            response = web3j.ethEstimateGas(transaction).send();
        } catch (IOException e) {
            throw unavailable("eth_estimateGas", e);
        }
        if (response == null) {
            throw new IllegalStateException("eth_estimateGas returned no response");
        }
        if (response.hasError()) {
            String message = response.getError().getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("revert")) {
                throw new TransactionRevertedException(null, message);
            }
            throw new IllegalStateException("eth_estimateGas failed: " + message);
        }
        return response.getAmountUsed();
    }

    @Override
    public TokenMetadata tokenMetadata(String token) {
        Function symbol = new Function("symbol", List.of(), List.of(new TypeReference<Utf8String>() { }));
        Function decimals = new Function("decimals", List.of(), List.of(new TypeReference<Uint8>() { }));
        String symbolValue = call(token, symbol).getValue().toString();
        BigInteger decimalsValue = (BigInteger) call(token, decimals).getValue();
        return new TokenMetadata(symbolValue, decimalsValue.intValue());
    }

    @Override
    public ConfirmationOutcome getConfirmation(String txHash) {
        int maxAttempts = Math.max(1, properties.getReceipt().getAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<ConfirmationOutcome> outcome = fetchReceipt(txHash);
                if (outcome.isPresent()) {
                    return outcome.get();
                }
            } catch (ConnectException | UnknownHostException e) {
                throw new ChainUnavailableException("RPC endpoint unreachable: " + e.getMessage(), e);
            } catch (IOException e) {
                log.debug("Receipt lookup for {} failed on attempt {}: {}", txHash, attempt, LogSanitizer.sanitize(e.getMessage()));
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        throw new ConfirmationTimeoutException(txHash,
            "no receipt for " + txHash + " after " + maxAttempts + " attempts");
    }

    @Override
    public Optional<ConfirmationOutcome> lookupConfirmation(String txHash) {
        try {
            return fetchReceipt(txHash);
        } catch (IOException e) {
            throw unavailable("eth_getTransactionReceipt", e);
        }
    }

    @Override
    public BigInteger nativeBalance(String account) {
        return send("eth_getBalance", web3j.ethGetBalance(account, DefaultBlockParameterName.LATEST)).getBalance();
    }

    @Override
    public BigInteger tokenBalance(String token, String account) {
        Function function = new Function(
            "balanceOf",
            List.of(new Address(account)),
            List.of(new TypeReference<Uint256>() { })
        );
        return (BigInteger) call(token, function).getValue();
    }

    @Override
    public String nftOwner(String collection, BigInteger tokenId) {
        Function function = new Function(
            "ownerOf",
            List.of(new Uint256(tokenId)),
            List.of(new TypeReference<Address>() { })
        );
        return call(collection, function).getValue().toString();
    }

    @Override
    public BigInteger nftBalance(String collection, BigInteger tokenId, String account) {
        Function function = new Function(
            "balanceOf",
            List.of(new Address(account), new Uint256(tokenId)),
            List.of(new TypeReference<Uint256>() { })
        );
        return (BigInteger) call(collection, function).getValue();
    }

    private Optional<ConfirmationOutcome> fetchReceipt(String txHash) throws IOException {
        EthGetTransactionReceipt response = web3j.ethGetTransactionReceipt(txHash).send();
        if (response == null || response.hasError()) {
            return Optional.empty();
        }
        return response.getTransactionReceipt().map(this::toOutcome);
    }

    private ConfirmationOutcome toOutcome(TransactionReceipt receipt) {
        Long blockNumber = receipt.getBlockNumberRaw() != null ? receipt.getBlockNumber().longValue() : null;
        BigInteger gasUsed = receipt.getGasUsedRaw() != null ? receipt.getGasUsed() : null;
        if (receipt.isStatusOK()) {
            return ConfirmationOutcome.confirmed(blockNumber, gasUsed);
        }
        String detail = receipt.getRevertReason() != null
            ? "transaction reverted: " + receipt.getRevertReason()
            : "transaction reverted";
        return ConfirmationOutcome.reverted(blockNumber, gasUsed, detail);
    }

    private Type<?> call(String contract, Function function) {
        String encoded = FunctionEncoder.encode(function);
        EthCall response = send("eth_call " + function.getName(), web3j.ethCall(
            Transaction.createEthCallTransaction(null, contract, encoded),
            DefaultBlockParameterName.LATEST
        ));
        if (response.isReverted()) {
            throw new IllegalStateException(function.getName() + " reverted on " + contract + ": " + response.getRevertReason());
        }
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (decoded.isEmpty()) {
            throw new IllegalStateException(function.getName() + " returned no data from " + contract);
        }
        return decoded.get(0);
    }

    private <T extends Response<?>> T send(String method, Request<?, T> request) {
        T response;
        try {
            response = request.send();
        } catch (IOException e) {
            throw unavailable(method, e);
        }
        if (response == null) {
            throw new IllegalStateException(method + " returned no response");
        }
        if (response.hasError()) {
            throw new IllegalStateException(method + " failed: " + response.getError().getMessage());
        }
        return response;
    }

    private RuntimeException unavailable(String method, IOException e) {
        if (e instanceof ConnectException || e instanceof UnknownHostException) {
            return new ChainUnavailableException("RPC endpoint unreachable during " + method + ": " + e.getMessage(), e);
        }
        return new IllegalStateException(method + " failed: " + e.getMessage(), e);
    }

    private void pause() {
        long interval = properties.getReceipt().getIntervalMillis();
        if (interval <= 0) {
            return;
        }
        try {
            Thread.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainUnavailableException("interrupted while waiting for confirmation", e);
        }
    }
}
