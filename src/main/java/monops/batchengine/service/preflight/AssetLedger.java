package monops.batchengine.service.preflight;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import monops.batchengine.dto.batch.AssetRef;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.service.chain.ChainQuery;
import monops.batchengine.util.EthereumAddressValidator;
import monops.batchengine.util.LogSanitizer;

/**
 * Running view of the signer's holdings during one preflight pass. Each chain read happens
 * at most once per asset; items then draw from the remaining amount in index order so a
 * later item that would overspend is caught before anything is sent.
 */
final class AssetLedger {

    private final ChainQuery chainQuery;
    private final String account;
    private final Map<String, BigInteger> remaining = new HashMap<>();
    private final Map<String, String> readFailures = new HashMap<>();
    private final Map<String, String> owners = new HashMap<>();
    private final Set<String> claimedTokens = new HashSet<>();

    AssetLedger(ChainQuery chainQuery, String account) {
        this.chainQuery = chainQuery;
        this.account = account;
    }

    /**
     * Draws the item's units from the ledger.
     *
     * @return null when the item is covered, otherwise the reason it is not
     */
    String reserve(OperationItem item) {
        AssetRef asset = item.assetRef();
        String key = asset.aggregationKey();
        return switch (asset.standard()) {
            case ERC721 -> claimToken(key, asset);
            case ERC1155 -> draw(key, item.units(), "token #" + asset.tokenId(),
                () -> chainQuery.nftBalance(asset.contractAddress(), asset.tokenId(), account));
            case ERC20 -> draw(key, item.units(), "token balance",
                () -> chainQuery.tokenBalance(asset.contractAddress(), account));
            case NATIVE -> draw(key, item.units(), "native balance",
                () -> chainQuery.nativeBalance(account));
        };
    }

    /**
     * Native balance left after all reserved native transfers; empty when it could not be read.
     */
    Optional<BigInteger> remainingNative() {
        String key = AssetRef.nativeCoin().aggregationKey();
        if (!load(key, () -> chainQuery.nativeBalance(account))) {
            return Optional.empty();
        }
        return Optional.of(remaining.get(key));
    }

    Optional<String> nativeReadFailure() {
        return Optional.ofNullable(readFailures.get(AssetRef.nativeCoin().aggregationKey()));
    }

    private String claimToken(String key, AssetRef asset) {
        if (claimedTokens.contains(key)) {
            return "token #" + asset.tokenId() + " is already used by an earlier item";
        }
        if (readFailures.containsKey(key)) {
            return readFailures.get(key);
        }
        String owner = owners.get(key);
        if (owner == null) {
            try {
                owner = chainQuery.nftOwner(asset.contractAddress(), asset.tokenId());
            } catch (RuntimeException e) {
                String reason = "unable to read owner of token #" + asset.tokenId() + ": " + LogSanitizer.errorMessage(e);
                readFailures.put(key, reason);
                return reason;
            }
            owners.put(key, owner);
        }
        if (!EthereumAddressValidator.sameAddress(owner, account)) {
            return "not owner of token #" + asset.tokenId();
        }
        claimedTokens.add(key);
        return null;
    }

    private String draw(String key, BigInteger units, String label, Supplier<BigInteger> balance) {
        if (!load(key, balance)) {
            return readFailures.get(key);
        }
        BigInteger available = remaining.get(key);
        if (units.compareTo(available) > 0) {
            return "insufficient " + label + ": required " + units + ", available " + available;
        }
        remaining.put(key, available.subtract(units));
        return null;
    }

    private boolean load(String key, Supplier<BigInteger> balance) {
        if (remaining.containsKey(key)) {
            return true;
        }
        if (readFailures.containsKey(key)) {
            return false;
        }
        try {
            BigInteger value = balance.get();
            remaining.put(key, value != null ? value : BigInteger.ZERO);
            return true;
        } catch (RuntimeException e) {
            readFailures.put(key, "unable to read balance: " + LogSanitizer.errorMessage(e));
            return false;
        }
    }
}
