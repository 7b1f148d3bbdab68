package monops.batchengine.service.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.math.BigInteger;
import java.net.ConnectException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetBalance;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import monops.batchengine.config.ChainProperties;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.dto.batch.OperationKind;
import monops.batchengine.dto.batch.TokenStandard;
import monops.batchengine.exception.ChainUnavailableException;
import monops.batchengine.exception.ConfirmationTimeoutException;
import monops.batchengine.exception.TransactionRevertedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("Web3jChainQuery Tests")
@SuppressWarnings({"unchecked", "rawtypes"})
class Web3jChainQueryTest {

    private static final String TX = "0x" + "ab".repeat(32);
    private static final String ACCOUNT = "0xabcdef0000000000000000000000000000000001";
    private static final String COLLECTION = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN = "0x3333333333333333333333333333333333333333";
    private static final String RECIPIENT = "0x1111111111111111111111111111111111111111";

    @Mock
    private Web3j web3j;

    private ChainProperties properties;
    private Web3jChainQuery chainQuery;

    @BeforeEach
    void setUp() {
        properties = new ChainProperties();
        properties.getReceipt().setAttempts(3);
        properties.getReceipt().setIntervalMillis(0);
        chainQuery = new Web3jChainQuery(web3j, properties, new OperationCallEncoder());
    }

    private static EthGetTransactionReceipt receipt(String status) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionHash(TX);
        receipt.setStatus(status);
        receipt.setBlockNumber("0x2a");
        receipt.setGasUsed("0x5208");
        EthGetTransactionReceipt response = new EthGetTransactionReceipt();
        response.setResult(receipt);
        return response;
    }

    private Request<?, EthEstimateGas> estimateGasRequest(EthEstimateGas response) throws IOException {
        Request<?, EthEstimateGas> request = (Request<?, EthEstimateGas>) mock(Request.class);
        when(request.send()).thenReturn(response);
        when(web3j.ethEstimateGas(any())).thenReturn((Request) request);
        return request;
    }

    private static Request<?, EthCall> callReturning(String result) throws IOException {
        Request<?, EthCall> request = (Request<?, EthCall>) mock(Request.class);
        EthCall call = new EthCall();
        call.setResult(result);
        when(request.send()).thenReturn(call);
        return request;
    }

    private Request<?, EthGetTransactionReceipt> receiptRequest() {
        Request<?, EthGetTransactionReceipt> request = (Request<?, EthGetTransactionReceipt>) mock(Request.class);
        when(web3j.ethGetTransactionReceipt(TX)).thenReturn((Request) request);
        return request;
    }

    @Nested
    @DisplayName("Confirmation polling")
    class ConfirmationTests {

        @Test
        void returnsConfirmedOnceReceiptAppears() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenReturn(new EthGetTransactionReceipt(), receipt("0x1"));

            ConfirmationOutcome outcome = chainQuery.getConfirmation(TX);

            assertThat(outcome.confirmed()).isTrue();
            assertThat(outcome.blockNumber()).isEqualTo(42L);
            assertThat(outcome.gasUsed()).isEqualTo(BigInteger.valueOf(21_000));
            verify(request, times(2)).send();
        }

        @Test
        void reportsRevertedReceipt() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenReturn(receipt("0x0"));

            ConfirmationOutcome outcome = chainQuery.getConfirmation(TX);

            assertThat(outcome.status()).isEqualTo(ConfirmationOutcome.Status.REVERTED);
            assertThat(outcome.detail()).startsWith("transaction reverted");
        }

        @Test
        void timesOutAfterConfiguredAttempts() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenReturn(new EthGetTransactionReceipt());

            assertThatThrownBy(() -> chainQuery.getConfirmation(TX))
                .isInstanceOf(ConfirmationTimeoutException.class)
                .hasMessageContaining("3 attempts");
            verify(request, times(3)).send();
        }

        @Test
        void transientIoErrorsKeepPolling() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenThrow(new IOException("read timed out")).thenReturn(receipt("0x1"));

            assertThat(chainQuery.getConfirmation(TX).confirmed()).isTrue();
        }

        @Test
        void unreachableEndpointIsFatal() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenThrow(new ConnectException("Connection refused"));

            assertThatThrownBy(() -> chainQuery.getConfirmation(TX))
                .isInstanceOf(ChainUnavailableException.class);
        }

        @Test
        void lookupDoesNotWait() throws Exception {
            Request<?, EthGetTransactionReceipt> request = receiptRequest();
            when(request.send()).thenReturn(new EthGetTransactionReceipt());

            assertThat(chainQuery.lookupConfirmation(TX)).isEmpty();
            verify(request, times(1)).send();
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        void estimateCostMultipliesConfiguredGasByGasPrice() throws Exception {
            Request<?, EthGasPrice> request = (Request<?, EthGasPrice>) mock(Request.class);
            EthGasPrice gasPrice = new EthGasPrice();
            gasPrice.setResult("0x3b9aca00");
            when(request.send()).thenReturn(gasPrice);
            when(web3j.ethGasPrice()).thenReturn((Request) request);

            CostEstimate estimate = chainQuery.estimateCost(OperationKind.NATIVE_TRANSFER);

            assertThat(estimate.gas()).isEqualTo(BigInteger.valueOf(21_000));
            assertThat(estimate.valueCost()).isEqualTo(BigInteger.valueOf(21_000).multiply(BigInteger.valueOf(1_000_000_000L)));
        }

        @Test
        void nativeBalanceReadsLatestBlock() throws Exception {
            Request<?, EthGetBalance> request = (Request<?, EthGetBalance>) mock(Request.class);
            EthGetBalance balance = new EthGetBalance();
            balance.setResult("0xde0b6b3a7640000");
            when(request.send()).thenReturn(balance);
            when(web3j.ethGetBalance(anyString(), any())).thenReturn((Request) request);

            assertThat(chainQuery.nativeBalance(ACCOUNT)).isEqualTo(new BigInteger("1000000000000000000"));
        }

        @Test
        void nftOwnerDecodesAddress() throws Exception {
            Request<?, EthCall> request = (Request<?, EthCall>) mock(Request.class);
            EthCall call = new EthCall();
            call.setResult("0x000000000000000000000000abcdef0000000000000000000000000000000001");
            when(request.send()).thenReturn(call);
            when(web3j.ethCall(any(), any())).thenReturn((Request) request);

            assertThat(chainQuery.nftOwner(COLLECTION, BigInteger.ONE)).isEqualTo(ACCOUNT);
        }

        @Test
        void unreachableEndpointOnReadIsChainUnavailable() throws Exception {
            Request<?, EthGetBalance> request = (Request<?, EthGetBalance>) mock(Request.class);
            when(request.send()).thenThrow(new ConnectException("Connection refused"));
            when(web3j.ethGetBalance(anyString(), any())).thenReturn((Request) request);

            assertThatThrownBy(() -> chainQuery.nativeBalance(ACCOUNT)).isInstanceOf(ChainUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("Simulation")
    class SimulationTests {

        @Test
        @DisplayName("Gas is estimated with the item's real calldata")
        void estimatesGasForTheEncodedTransfer() throws Exception {
            EthEstimateGas estimate = new EthEstimateGas();
            estimate.setResult("0xea60");
            estimateGasRequest(estimate);
            OperationItem item = OperationItem.nftTransfer(0, COLLECTION, BigInteger.valueOf(7), TokenStandard.ERC721, RECIPIENT, null);

            BigInteger gas = chainQuery.estimateGas(item, ACCOUNT);

            assertThat(gas).isEqualTo(BigInteger.valueOf(60_000));
            ArgumentCaptor<Transaction> sent = ArgumentCaptor.forClass(Transaction.class);
            verify(web3j).ethEstimateGas(sent.capture());
            assertThat(sent.getValue().getFrom()).isEqualTo(ACCOUNT);
            assertThat(sent.getValue().getTo()).isEqualTo(COLLECTION);
            assertThat(sent.getValue().getData())
                .isEqualTo(new OperationCallEncoder().encode(item, ACCOUNT).data());
        }

        @Test
        void revertingCallIsReportedAsRevert() throws Exception {
            EthEstimateGas estimate = new EthEstimateGas();
            estimate.setError(new Response.Error(3, "execution reverted: ERC721: caller is not token owner or approved"));
            estimateGasRequest(estimate);

            assertThatThrownBy(() -> chainQuery.estimateGas(
                OperationItem.nftTransfer(0, COLLECTION, BigInteger.ONE, TokenStandard.ERC721, RECIPIENT, null), ACCOUNT))
                .isInstanceOf(TransactionRevertedException.class)
                .hasMessageContaining("not token owner or approved");
        }

        @Test
        void otherEstimateErrorsAreNotReverts() throws Exception {
            EthEstimateGas estimate = new EthEstimateGas();
            estimate.setError(new Response.Error(-32000, "header not found"));
            estimateGasRequest(estimate);

            assertThatThrownBy(() -> chainQuery.estimateGas(OperationItem.nativeTransfer(0, RECIPIENT, BigInteger.ONE), ACCOUNT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("eth_estimateGas failed: header not found");
        }

        @Test
        void readsErc20SymbolAndDecimals() throws Exception {
            Request<?, EthCall> symbol = callReturning("0x"
                + "0000000000000000000000000000000000000000000000000000000000000020"
                + "0000000000000000000000000000000000000000000000000000000000000004"
                + "5553444300000000000000000000000000000000000000000000000000000000");
            Request<?, EthCall> decimals = callReturning(
                "0x0000000000000000000000000000000000000000000000000000000000000006");
            when(web3j.ethCall(any(), any())).thenReturn((Request) symbol, (Request) decimals);

            assertThat(chainQuery.tokenMetadata(TOKEN)).isEqualTo(new TokenMetadata("USDC", 6));
        }

        @Test
        void contractWithoutMetadataFails() throws Exception {
            Request<?, EthCall> empty = callReturning("0x");
            when(web3j.ethCall(any(), any())).thenReturn((Request) empty);

            assertThatThrownBy(() -> chainQuery.tokenMetadata(TOKEN))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("symbol returned no data");
        }
    }
}
