package com.loan.crm.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PartyType {

    LEAD,
    BORROWER;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
