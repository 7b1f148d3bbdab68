package monops.batchengine.service.preflight;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import monops.batchengine.config.ChainProperties;
import monops.batchengine.dto.batch.AssetRef;
import monops.batchengine.dto.batch.ItemValidation;
import monops.batchengine.dto.batch.OperationItem;
import monops.batchengine.dto.batch.OperationKind;
import monops.batchengine.dto.batch.PreflightOutcome;
import monops.batchengine.dto.batch.PreflightReport;
import monops.batchengine.dto.batch.TokenStandard;
import monops.batchengine.exception.TransactionRevertedException;
import monops.batchengine.service.chain.ChainQuery;
import monops.batchengine.service.chain.CostEstimate;
import monops.batchengine.util.EthereumAddressValidator;
import monops.batchengine.util.LogSanitizer;

/**
 * Checks a list of operations against structural rules, the signer's holdings and the
 * expected gas cost before anything is signed. Only reads from the chain; never touches
 * batch storage, so it is safe to call repeatedly and concurrently.
 */
@Service
@Slf4j
public class PreflightValidator {

    static final String EMPTY_BATCH = "batch contains no items";
    static final String INVALID_SIGNER = "invalid signer account";
    static final String INSUFFICIENT_FOR_COST = "insufficient native balance for estimated cost";
    static final String INVALID_TOKEN = "Failed to fetch token metadata. Is this a valid ERC-20?";

    private final ChainQuery chainQuery;
    private final ChainProperties chainProperties;

    public PreflightValidator(ChainQuery chainQuery, ChainProperties chainProperties) {
        this.chainQuery = chainQuery;
        this.chainProperties = chainProperties;
    }

    /**
     * Truncates {@code items} to {@code planLimit} and validates what remains.
     *
     * @throws IllegalArgumentException if {@code planLimit} is below 1
     */
    public PreflightOutcome preflight(List<OperationItem> items, String account, int planLimit) {
        if (planLimit < 1) {
            throw new IllegalArgumentException("planLimit must be at least 1");
        }
        List<OperationItem> all = items != null ? items : List.of();
        List<OperationItem> accepted = Collections.unmodifiableList(new ArrayList<>(all.subList(0, Math.min(all.size(), planLimit))));
        int discarded = all.size() - accepted.size();
        if (discarded > 0) {
            log.info("Batch for {} truncated to plan limit {} ({} item(s) discarded)",
                LogSanitizer.maskAddress(account), planLimit, discarded);
        }
        return new PreflightOutcome(accepted, discarded, planLimit, validate(accepted, account));
    }

    private PreflightReport validate(List<OperationItem> items, String account) {
        if (items.isEmpty()) {
            return PreflightReport.rejected(EMPTY_BATCH);
        }
        Map<Integer, ItemValidation> perItem = new LinkedHashMap<>();
        List<String> batchReasons = new ArrayList<>();

        if (!EthereumAddressValidator.isValidAddress(account)) {
            for (int i = 0; i < items.size(); i++) {
                perItem.put(i, ItemValidation.invalid(i, INVALID_SIGNER));
            }
            batchReasons.add(INVALID_SIGNER);
            return PreflightReport.of(perItem, batchReasons, BigInteger.ZERO, BigInteger.ZERO);
        }

        List<OperationItem> wellFormed = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            OperationItem item = items.get(i);
            String reason = structuralProblem(item, i, account);
            if (reason != null) {
                perItem.put(i, ItemValidation.invalid(i, reason));
            } else {
                wellFormed.add(item);
            }
        }

        Map<OperationKind, CostEstimate> unitCosts = estimateCosts(wellFormed, batchReasons);
        Map<String, Boolean> tokenChecks = new HashMap<>();
        AssetLedger ledger = new AssetLedger(chainQuery, account);
        BigInteger gasTotal = BigInteger.ZERO;
        BigInteger costTotal = BigInteger.ZERO;
        for (OperationItem item : wellFormed) {
            String reason = isErc20(item) && !isReadableToken(item.assetRef().contractAddress(), tokenChecks)
                ? INVALID_TOKEN
                : ledger.reserve(item);
            if (reason != null) {
                perItem.put(item.index(), ItemValidation.invalid(item.index(), reason));
                continue;
            }
            CostEstimate unit = unitCosts.get(item.kind());
            BigInteger gas;
            try {
                gas = simulatedGas(item, account, unit.gas());
            } catch (TransactionRevertedException e) {
                perItem.put(item.index(), ItemValidation.invalid(item.index(),
                    "transaction would revert: " + LogSanitizer.errorMessage(e)));
                continue;
            }
            gasTotal = gasTotal.add(gas);
            costTotal = costTotal.add(scale(unit, gas));
            perItem.put(item.index(), ItemValidation.valid(item.index(), gas));
        }

        if (!wellFormed.isEmpty()) {
            Optional<BigInteger> nativeLeft = ledger.remainingNative();
            if (nativeLeft.isEmpty()) {
                batchReasons.add(ledger.nativeReadFailure().orElse("unable to read native balance"));
            } else if (nativeLeft.get().compareTo(costTotal) < 0) {
                batchReasons.add(INSUFFICIENT_FOR_COST);
            }
        }

        PreflightReport report = PreflightReport.of(perItem, batchReasons, gasTotal, costTotal);
        log.debug("Preflight for {}: {} item(s), valid={}, invalid={}",
            LogSanitizer.maskAddress(account), items.size(), report.overallValid(), report.invalidIndices());
        return report;
    }

    /**
     * Gas from simulating the item itself; the kind's gas is used when the simulation cannot run.
     */
    private BigInteger simulatedGas(OperationItem item, String account, BigInteger fallback) {
        try {
            BigInteger gas = chainQuery.estimateGas(item, account);
            return gas != null && gas.signum() > 0 ? gas : fallback;
        } catch (TransactionRevertedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Gas simulation for item {} failed, using {}: {}", item.index(), fallback,
                LogSanitizer.sanitize(e.getMessage()));
            return fallback;
        }
    }

    private static BigInteger scale(CostEstimate unit, BigInteger gas) {
        if (unit.gas().signum() <= 0) {
            return BigInteger.ZERO;
        }
        return unit.valueCost().multiply(gas).divide(unit.gas());
    }

    private static boolean isErc20(OperationItem item) {
        return item.assetRef().standard() == TokenStandard.ERC20;
    }

    /**
     * Reads symbol and decimals once per contract; a contract that answers neither is not an ERC-20.
     */
    private boolean isReadableToken(String token, Map<String, Boolean> checked) {
        return checked.computeIfAbsent(token.toLowerCase(Locale.ROOT), key -> {
            try {
                return chainQuery.tokenMetadata(token) != null;
            } catch (RuntimeException e) {
                log.warn("Token metadata for {} unavailable: {}", LogSanitizer.maskAddress(token),
                    LogSanitizer.sanitize(e.getMessage()));
                return false;
            }
        });
    }

    /**
     * One estimate per distinct kind, giving the gas price basis for the per-item simulations.
     * A failed estimate falls back to the configured gas limit and fallback gas price.
     */
    private Map<OperationKind, CostEstimate> estimateCosts(List<OperationItem> items, List<String> batchReasons) {
        Map<OperationKind, CostEstimate> costs = new EnumMap<>(OperationKind.class);
        for (OperationItem item : items) {
            OperationKind kind = item.kind();
            if (costs.containsKey(kind)) {
                continue;
            }
            try {
                costs.put(kind, chainQuery.estimateCost(kind));
            } catch (RuntimeException e) {
                BigInteger gas = chainProperties.getGas().limitFor(kind);
                BigInteger fallbackPrice = chainProperties.getGas().fallbackPriceWei();
                log.warn("Cost estimation for {} failed, using default gas {}: {}",
                    kind.getWireValue(), gas, LogSanitizer.sanitize(e.getMessage()));
                if (fallbackPrice == null) {
                    batchReasons.add("cost estimation failed for " + kind.getWireValue());
                    costs.put(kind, new CostEstimate(gas, BigInteger.ZERO));
                } else {
                    costs.put(kind, new CostEstimate(gas, gas.multiply(fallbackPrice)));
                }
            }
        }
        return costs;
    }

    private String structuralProblem(OperationItem item, int position, String account) {
        if (item == null) {
            return "item is missing";
        }
        if (item.index() != position) {
            return "index " + item.index() + " does not match position " + position;
        }
        OperationKind kind = item.kind();
        AssetRef asset = item.assetRef();
        if (kind == null) {
            return "operation kind is required";
        }
        if (asset == null || asset.standard() == null) {
            return "asset reference is required";
        }
        TokenStandard standard = asset.standard();
        if (!kind.supports(standard)) {
            return kind.getWireValue() + " does not apply to " + standard;
        }
        if (standard != TokenStandard.NATIVE && !EthereumAddressValidator.isValidAddress(asset.contractAddress())) {
            return "invalid contract address";
        }
        if (standard.isNft()) {
            if (asset.tokenId() == null) {
                return "token id is required";
            }
            if (asset.tokenId().signum() < 0) {
                return "token id must not be negative";
            }
        }
        if (kind.isTransfer()) {
            if (!EthereumAddressValidator.isValidAddress(item.recipient())) {
                return "invalid recipient address";
            }
            if (EthereumAddressValidator.sameAddress(item.recipient(), account)) {
                return "recipient must differ from signer";
            }
        }
        BigInteger amount = item.amount();
        switch (standard) {
            case ERC721 -> {
                if (amount != null && !BigInteger.ONE.equals(amount)) {
                    return "ERC-721 amount must be 1";
                }
            }
            case ERC1155 -> {
                if (amount != null && amount.signum() <= 0) {
                    return "amount must be positive";
                }
            }
            case ERC20, NATIVE -> {
                if (amount == null || amount.signum() <= 0) {
                    return "amount must be positive";
                }
            }
        }
        return null;
    }
}
