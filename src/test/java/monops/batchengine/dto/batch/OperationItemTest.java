package monops.batchengine.dto.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class OperationItemTest {

    private static final String COLLECTION = "0x2222222222222222222222222222222222222222";
    private static final String RECIPIENT = "0x1111111111111111111111111111111111111111";

    @Test
    void burnsTargetTheBurnAddress() {
        OperationItem burn = OperationItem.nftBurn(0, COLLECTION, BigInteger.ONE, TokenStandard.ERC721, null);
        OperationItem transfer = OperationItem.nftTransfer(1, COLLECTION, BigInteger.ONE, TokenStandard.ERC721, RECIPIENT, null);

        assertThat(burn.destination()).isEqualTo(OperationItem.BURN_ADDRESS);
        assertThat(transfer.destination()).isEqualTo(RECIPIENT);
    }

    @Test
    void unitsDefaultToOneForNfts() {
        assertThat(OperationItem.nftTransfer(0, COLLECTION, BigInteger.ONE, TokenStandard.ERC721, RECIPIENT, null).units())
            .isEqualTo(BigInteger.ONE);
        assertThat(OperationItem.nftTransfer(0, COLLECTION, BigInteger.ONE, TokenStandard.ERC1155, RECIPIENT, null).units())
            .isEqualTo(BigInteger.ONE);
        assertThat(OperationItem.nftTransfer(0, COLLECTION, BigInteger.ONE, TokenStandard.ERC1155, RECIPIENT, BigInteger.valueOf(7)).units())
            .isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    void aggregationKeyIgnoresAddressCase() {
        AssetRef upper = AssetRef.token("0xABCDEF0000000000000000000000000000000001");
        AssetRef lower = AssetRef.token("0xabcdef0000000000000000000000000000000001");

        assertThat(upper.aggregationKey()).isEqualTo(lower.aggregationKey());
        assertThat(AssetRef.nft(COLLECTION, BigInteger.ONE, TokenStandard.ERC721).aggregationKey())
            .isNotEqualTo(AssetRef.nft(COLLECTION, BigInteger.TWO, TokenStandard.ERC721).aggregationKey());
    }

    @Test
    void kindsResolveFromWireValues() {
        assertThat(OperationKind.fromWireValue("token_burn")).isEqualTo(OperationKind.TOKEN_BURN);
        assertThat(OperationKind.NFT_BURN.isTransfer()).isFalse();
        assertThat(OperationKind.NFT_TRANSFER.supports(TokenStandard.ERC20)).isFalse();
        assertThatThrownBy(() -> OperationKind.fromWireValue("mint")).isInstanceOf(IllegalArgumentException.class);
    }
}
