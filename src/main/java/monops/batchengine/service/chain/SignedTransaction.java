package monops.batchengine.service.chain;

/**
 * A transaction signed for one item but not necessarily broadcast yet. The hash is known
 * before anything leaves the process, so it can be persisted ahead of the broadcast.
 */
public record SignedTransaction(String txHash, String payload) { }
