package com.loan.crm.exception;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {

    INVALID_ROW("InvalidRow"),
    SLOT_FULL("SlotFull"),
    NO_SLOT_AVAILABLE("NoSlotAvailable"),
    ELIGIBILITY_CHECK_FAILED("EligibilityCheckFailed"),
    EXTERNAL_NOTIFY_FAILED("ExternalNotifyFailed"),
    CONCURRENT_UPDATE_CONFLICT("ConcurrentUpdateConflict"),
    NOT_ELIGIBLE("NotEligible"),
    STORAGE_FAILURE("StorageFailure");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
