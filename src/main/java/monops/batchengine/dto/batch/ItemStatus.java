package monops.batchengine.dto.batch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemStatus {
    PENDING("pending"),
    IN_FLIGHT("in_flight"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireValue;

    ItemStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /**
     * IN_FLIGHT may fall back to PENDING only through reconciliation, when no transaction
     * hash was ever recorded for the item.
     */
    public boolean canTransitionTo(ItemStatus next) {
        return switch (this) {
            case PENDING -> next == IN_FLIGHT || next == SKIPPED;
            case IN_FLIGHT -> next == SUCCEEDED || next == FAILED || next == PENDING;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }

    public static ItemStatus fromWireValue(String value) {
        for (ItemStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown item status: " + value);
    }
}
