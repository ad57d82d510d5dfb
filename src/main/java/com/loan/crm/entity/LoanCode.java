package com.loan.crm.entity;

import java.util.Locale;

/**
 * Outcome marker written by underwriters on the call sheet.
 */
public enum LoanCode {

    /** Approved. */
    P,
    /** Approved, customer rejected. */
    PRS,
    /** Rejected by system, special reason. */
    RS,
    /** Rejected. */
    R,
    OTHER;

    public static LoanCode fromSheet(String raw) {
        if (raw == null) {
            return OTHER;
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        for (LoanCode c : values()) {
            if (c != OTHER && c.name().equals(code)) {
                return c;
            }
        }
        return OTHER;
    }

    public boolean isKnown() {
        return this != OTHER;
    }
}
