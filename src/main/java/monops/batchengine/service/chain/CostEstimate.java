package monops.batchengine.service.chain;

import java.math.BigInteger;

/**
 * Gas units for one item of a kind and their price in wei.
 */
public record CostEstimate(BigInteger gas, BigInteger valueCost) {
}
