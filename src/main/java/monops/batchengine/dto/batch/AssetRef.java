package monops.batchengine.dto.batch;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Reference to the asset an operation moves: an NFT (collection + token id), an ERC-20 contract,
 * or the chain's native coin (no contract).
 */
public record AssetRef(String contractAddress, BigInteger tokenId, TokenStandard standard) {

    public static AssetRef nft(String collectionAddress, BigInteger tokenId, TokenStandard standard) {
        return new AssetRef(collectionAddress, tokenId, standard);
    }

    public static AssetRef token(String tokenAddress) {
        return new AssetRef(tokenAddress, null, TokenStandard.ERC20);
    }

    public static AssetRef nativeCoin() {
        return new AssetRef(null, null, TokenStandard.NATIVE);
    }

    /**
     * Key under which items touching the same asset share one balance during preflight.
     */
    public String aggregationKey() {
        String contract = contractAddress == null ? "-" : contractAddress.toLowerCase(Locale.ROOT);
        String id = tokenId == null ? "-" : tokenId.toString();
        return standard + ":" + contract + ":" + id;
    }
}
