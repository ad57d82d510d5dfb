package com.loan.crm.dto;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

public enum RunMode {
    LIVE,
    END_OF_DAY;

    /** Accepts live, realtime and end_of_day; blank means live. */
    public static Optional<RunMode> parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.of(LIVE);
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "live":
            case "realtime":
                return Optional.of(LIVE);
            case "end_of_day":
            case "end-of-day":
                return Optional.of(END_OF_DAY);
            default:
                return Optional.empty();
        }
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
