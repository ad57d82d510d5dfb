package com.loan.crm.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Pipeline status shared by leads and borrowers. Persisted by its wire value
 * (see {@link LeadStatusConverter}) because {@code missed/RS} is not a valid enum name.
 */
public enum LeadStatus {

    NEW("new"),
    ASSIGNED("assigned"),
    NO_ANSWER("no_answer"),
    FOLLOW_UP("follow_up"),
    BOOKED("booked"),
    DONE("done"),
    MISSED_RS("missed/RS"),
    UNQUALIFIED("unqualified"),
    GIVE_UP("give_up"),
    BLACKLISTED("blacklisted");

    private final String value;

    LeadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LeadStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lead status: " + value));
    }
}
