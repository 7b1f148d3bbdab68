package monops.batchengine.dto.batch;

/**
 * Token standard of the asset an operation touches.
 */
public enum TokenStandard {
    ERC721,
    ERC1155,
    ERC20,
    NATIVE;

    public boolean isNft() {
        return this == ERC721 || this == ERC1155;
    }
}
