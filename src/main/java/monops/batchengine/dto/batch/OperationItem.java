package monops.batchengine.dto.batch;

import java.math.BigInteger;

/**
 * One intended on-chain write. {@code index} fixes the execution order inside its batch.
 */
public record OperationItem(
    int index,
    OperationKind kind,
    String recipient,
    AssetRef assetRef,
    BigInteger amount
) {

    public static final String BURN_ADDRESS = "0x000000000000000000000000000000000000dEaD";

    public static OperationItem nftTransfer(int index, String collection, BigInteger tokenId,
                                            TokenStandard standard, String recipient, BigInteger amount) {
        return new OperationItem(index, OperationKind.NFT_TRANSFER, recipient,
            AssetRef.nft(collection, tokenId, standard), amount);
    }

    public static OperationItem nftBurn(int index, String collection, BigInteger tokenId,
                                        TokenStandard standard, BigInteger amount) {
        return new OperationItem(index, OperationKind.NFT_BURN, null,
            AssetRef.nft(collection, tokenId, standard), amount);
    }

    public static OperationItem tokenTransfer(int index, String token, String recipient, BigInteger amount) {
        return new OperationItem(index, OperationKind.TOKEN_TRANSFER, recipient, AssetRef.token(token), amount);
    }

    public static OperationItem tokenBurn(int index, String token, BigInteger amount) {
        return new OperationItem(index, OperationKind.TOKEN_BURN, null, AssetRef.token(token), amount);
    }

    public static OperationItem nativeTransfer(int index, String recipient, BigInteger amount) {
        return new OperationItem(index, OperationKind.NATIVE_TRANSFER, recipient, AssetRef.nativeCoin(), amount);
    }

    /**
     * Address the operation actually sends to.
     */
    public String destination() {
        return kind != null && !kind.isTransfer() ? BURN_ADDRESS : recipient;
    }

    /**
     * Units moved by the operation. ERC-721 always moves exactly one token and ERC-1155
     * defaults to one when no amount was given.
     */
    public BigInteger units() {
        TokenStandard standard = assetRef == null ? null : assetRef.standard();
        if (standard == TokenStandard.ERC721) {
            return BigInteger.ONE;
        }
        if (standard == TokenStandard.ERC1155 && amount == null) {
            return BigInteger.ONE;
        }
        return amount;
    }

    public OperationItem withIndex(int newIndex) {
        return new OperationItem(newIndex, kind, recipient, assetRef, amount);
    }
}
