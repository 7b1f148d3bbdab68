package monops.batchengine.service.chain;

/**
 * ERC-20 symbol and decimals, read to confirm a contract actually speaks ERC-20.
 */
public record TokenMetadata(String symbol, int decimals) { }
