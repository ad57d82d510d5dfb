package com.loan.crm.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionKind {
    CREATE_LEAD,
    CREATE_APPOINTMENT,
    MOVE_APPOINTMENT,
    UPDATE_APPOINTMENT,
    UPDATE_BORROWER_APPOINTMENT,
    TIMEOUT_APPOINTMENT,
    FINAL_STATUS_UPDATE,
    REJECT_ROW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
