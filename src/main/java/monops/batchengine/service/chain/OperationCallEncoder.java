package monops.batchengine.service.chain;

import java.math.BigInteger;
import java.util.List;

import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import monops.batchengine.dto.batch.AssetRef;
import monops.batchengine.dto.batch.OperationItem;

/**
 * Builds the transaction target, value and calldata for an operation item. Burns are plain
 * transfers to the burn address, so every standard goes through its transfer entry point.
 */
@Component
public class OperationCallEncoder {

    public record EncodedCall(String to, BigInteger value, String data) { }

    public EncodedCall encode(OperationItem item, String from) {
        AssetRef asset = item.assetRef();
        String destination = item.destination();
        return switch (asset.standard()) {
            case NATIVE -> new EncodedCall(destination, item.amount(), "");
            case ERC20 -> new EncodedCall(asset.contractAddress(), BigInteger.ZERO, FunctionEncoder.encode(new Function(
                "transfer",
                List.of(new Address(destination), new Uint256(item.amount())),
                List.of()
            )));
            case ERC721 -> new EncodedCall(asset.contractAddress(), BigInteger.ZERO, FunctionEncoder.encode(new Function(
                "safeTransferFrom",
                List.of(new Address(from), new Address(destination), new Uint256(asset.tokenId())),
                List.of()
            )));
            case ERC1155 -> new EncodedCall(asset.contractAddress(), BigInteger.ZERO, FunctionEncoder.encode(new Function(
                "safeTransferFrom",
                List.of(
                    new Address(from),
                    new Address(destination),
                    new Uint256(asset.tokenId()),
                    new Uint256(item.units()),
                    new DynamicBytes(new byte[0])
                ),
                List.of()
            )));
        };
    }
}
