package monops.batchengine.dto.batch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchStatus {
    DRAFT("draft"),
    VALIDATED("validated"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    BatchStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Statuses from which the executor may (re)start driving the batch. A FAILED batch is
     * runnable again when the caller retries its remaining Pending items.
     */
    public boolean isRunnable() {
        return this == VALIDATED || this == RUNNING || this == PAUSED || this == FAILED;
    }

    public boolean isHalted() {
        return this == COMPLETED || this == FAILED;
    }

    public static BatchStatus fromWireValue(String value) {
        for (BatchStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown batch status: " + value);
    }
}
