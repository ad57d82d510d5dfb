package com.loan.crm.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Day-first dates as typed into the call sheet: 21/03/25, 21-03-2025, 21/03/2025 14:30.
 */
public final class SheetDates {

    private static final Pattern DAY_FIRST =
            Pattern.compile("^(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2}|\\d{4})(?:\\s+.*)?$");

    private SheetDates() {
    }

    /**
     * @return the parsed date, or empty when the value does not match or is not a real calendar date
     */
    public static Optional<LocalDate> parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        Matcher m = DAY_FIRST.matcher(raw.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        int day = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        String yearText = m.group(3);
        int year = Integer.parseInt(yearText);
        if (yearText.length() == 2) {
            year += 2000;
        }
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
