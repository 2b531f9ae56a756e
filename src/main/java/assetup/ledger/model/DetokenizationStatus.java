package assetup.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of the detokenization proposal of one asset.
 * PROPOSED and PASSED are live; REJECTED and EXECUTED are terminal.
 */
public enum DetokenizationStatus {
    NONE("none"),
    PROPOSED("proposed"),
    PASSED("passed"),
    REJECTED("rejected"),
    EXECUTED("executed");

    private final String wireValue;

    DetokenizationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isLive() {
        return this == PROPOSED || this == PASSED;
    }
}
