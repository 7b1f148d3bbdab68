package monops.batchengine.service.chain;

import java.math.BigInteger;

public record ConfirmationOutcome(Status status, Long blockNumber, BigInteger gasUsed, String detail) {

    public enum Status {
        CONFIRMED,
        REVERTED
    }

    public static ConfirmationOutcome confirmed(Long blockNumber, BigInteger gasUsed) {
        return new ConfirmationOutcome(Status.CONFIRMED, blockNumber, gasUsed, null);
    }

    public static ConfirmationOutcome reverted(Long blockNumber, BigInteger gasUsed, String detail) {
        return new ConfirmationOutcome(Status.REVERTED, blockNumber, gasUsed, detail);
    }

    public boolean confirmed() {
        return status == Status.CONFIRMED;
    }
}
