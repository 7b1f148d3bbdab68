package monops.batchengine.dto.batch;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationKind {
    NFT_TRANSFER("nft_transfer", EnumSet.of(TokenStandard.ERC721, TokenStandard.ERC1155), true),
    NFT_BURN("nft_burn", EnumSet.of(TokenStandard.ERC721, TokenStandard.ERC1155), false),
    TOKEN_TRANSFER("token_transfer", EnumSet.of(TokenStandard.ERC20), true),
    TOKEN_BURN("token_burn", EnumSet.of(TokenStandard.ERC20), false),
    NATIVE_TRANSFER("native_transfer", EnumSet.of(TokenStandard.NATIVE), true);

    private final String wireValue;
    private final Set<TokenStandard> standards;
    private final boolean transfer;

    OperationKind(String wireValue, Set<TokenStandard> standards, boolean transfer) {
        this.wireValue = wireValue;
        this.standards = standards;
        this.transfer = transfer;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Transfer kinds carry a caller-chosen recipient; burn kinds always target the burn address.
     */
    public boolean isTransfer() {
        return transfer;
    }

    public boolean supports(TokenStandard standard) {
        return standard != null && standards.contains(standard);
    }

    public static OperationKind fromWireValue(String value) {
        for (OperationKind kind : values()) {
            if (kind.wireValue.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + value);
    }
}
