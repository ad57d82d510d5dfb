package com.loan.crm.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Singapore phone numbers. The comparable key is the 8-digit local number.
 */
public final class PhoneNormalizer {

    public static final String COUNTRY_CODE = "65";
    private static final int LOCAL_LENGTH = 8;

    private PhoneNormalizer() {
    }

    /**
     * Digits-only key. Accepts a bare 8-digit number, or one prefixed with 65 / +65.
     */
    public static Optional<String> toKey(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == LOCAL_LENGTH) {
            return Optional.of(digits);
        }
        if (digits.length() == LOCAL_LENGTH + COUNTRY_CODE.length() && digits.startsWith(COUNTRY_CODE)) {
            return Optional.of(digits.substring(COUNTRY_CODE.length()));
        }
        return Optional.empty();
    }

    public static String toStoredFormat(String key) {
        return "+" + COUNTRY_CODE + key;
    }

    /** Key column value for a stored phone; null when the phone is absent or not a Singapore number. */
    public static String keyOrNull(String raw) {
        return toKey(raw).orElse(null);
    }
}
