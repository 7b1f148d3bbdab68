package monops.batchengine.config;

import java.math.BigInteger;

import lombok.Data;
import monops.batchengine.dto.batch.OperationKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.web3j.utils.Convert;

@Data
@Component
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /** JSON-RPC endpoint used for reads, gas prices and receipts. */
    private String rpcUrl = "https://testnet-rpc.monad.xyz";

    /** EIP-155 chain id used when signing with a local keystore. */
    private long chainId = 10143L;

    private Gas gas = new Gas();

    private Receipt receipt = new Receipt();

    @Data
    public static class Gas {
        /** Used for cost estimates when eth_gasPrice fails. */
        private BigInteger fallbackPriceGwei = BigInteger.valueOf(50);

        private long nftTransfer = 100_000L;
        private long nftBurn = 100_000L;
        private long tokenTransfer = 65_000L;
        private long tokenBurn = 65_000L;
        private long nativeTransfer = 21_000L;

        public BigInteger limitFor(OperationKind kind) {
            long limit = switch (kind) {
                case NFT_TRANSFER -> nftTransfer;
                case NFT_BURN -> nftBurn;
                case TOKEN_TRANSFER -> tokenTransfer;
                case TOKEN_BURN -> tokenBurn;
                case NATIVE_TRANSFER -> nativeTransfer;
            };
            return BigInteger.valueOf(limit);
        }

        public BigInteger fallbackPriceWei() {
            if (fallbackPriceGwei == null) {
                return null;
            }
            return Convert.toWei(fallbackPriceGwei.toString(), Convert.Unit.GWEI).toBigInteger();
        }
    }

    @Data
    public static class Receipt {
        private int attempts = 40;
        private long intervalMillis = 1500L;
    }
}
