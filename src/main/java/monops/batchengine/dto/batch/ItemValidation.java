package monops.batchengine.dto.batch;

import java.math.BigInteger;

public record ItemValidation(int index, boolean valid, String reason, BigInteger estimatedGas) {

    public static ItemValidation valid(int index, BigInteger estimatedGas) {
        return new ItemValidation(index, true, null, estimatedGas);
    }

    public static ItemValidation invalid(int index, String reason) {
        return new ItemValidation(index, false, reason, BigInteger.ZERO);
    }
}
