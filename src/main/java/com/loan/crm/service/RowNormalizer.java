package com.loan.crm.service;

import com.loan.crm.dto.CallOutcome;
import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.LoanType;
import com.loan.crm.exception.ReconciliationException;
import com.loan.crm.utils.PhoneNormalizer;
import com.loan.crm.utils.SheetDates;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a free-form call sheet row into a {@link CallOutcome}.
 * Header lookup ignores case, spacing, underscores and the {@code col_} prefix some exporters add.
 */
@Component
public class RowNormalizer {

    static final List<String> PHONE_ALIASES = List.of("mobile number", "h/p", "phone", "phone number", "mobile", "contact number");
    static final List<String> CODE_ALIASES = List.of("code");
    static final List<String> UW_ALIASES = List.of("uw");
    static final List<String> NAME_ALIASES = List.of("name", "full name", "customer name", "client name");
    static final List<String> DATE_ALIASES = List.of("date", "appointment date", "date of visit");
    static final List<String> LOAN_TYPE_ALIASES = List.of("new or reloan", "new/reloan", "loan type");
    static final List<String> RS_ALIASES = List.of("rs", "rs reason");
    static final List<String> RS_DETAIL_ALIASES = List.of("rs detailed", "rs details", "rs detail");
    static final List<String> EMAIL_ALIASES = List.of("email", "email address");
    static final List<String> AMOUNT_ALIASES = List.of("loan amount", "amount");
    static final List<String> EMPLOYMENT_ALIASES = List.of("employment type", "employment status", "employment");
    static final List<String> PURPOSE_ALIASES = List.of("loan purpose", "purpose");
    static final List<String> SOURCE_ALIASES = List.of("source", "lead source");

    /**
     * @throws ReconciliationException with kind INVALID_ROW when the phone or the date cannot be used
     */
    public CallOutcome normalize(int rowNumber, Map<String, ?> row) {
        Map<String, String> cells = canonicalize(row);

        String rawPhone = first(cells, PHONE_ALIASES);
        if (rawPhone == null) {
            throw ReconciliationException.invalidRow("Row " + rowNumber + ": missing phone number");
        }
        String phoneKey = PhoneNormalizer.toKey(rawPhone)
                .orElseThrow(() -> ReconciliationException.invalidRow(
                        "Row " + rowNumber + ": invalid phone number '" + rawPhone + "'"));

        String rawDate = first(cells, DATE_ALIASES);
        LocalDate rowDate = null;
        if (rawDate != null) {
            rowDate = SheetDates.parse(rawDate).orElseThrow(() -> ReconciliationException.invalidRow(
                    "Row " + rowNumber + ": unparseable date '" + rawDate + "'"));
        }

        return CallOutcome.builder()
                .rowNumber(rowNumber)
                .rawPhone(rawPhone)
                .phoneKey(phoneKey)
                .fullName(first(cells, NAME_ALIASES))
                .code(LoanCode.fromSheet(first(cells, CODE_ALIASES)))
                .uwFilled(isUwFilled(first(cells, UW_ALIASES)))
                .loanType(loanType(first(cells, LOAN_TYPE_ALIASES)))
                .rawDate(rawDate)
                .rowDate(rowDate)
                .rsReason(first(cells, RS_ALIASES))
                .rsDetail(first(cells, RS_DETAIL_ALIASES))
                .email(first(cells, EMAIL_ALIASES))
                .loanAmount(first(cells, AMOUNT_ALIASES))
                .employmentType(first(cells, EMPLOYMENT_ALIASES))
                .loanPurpose(first(cells, PURPOSE_ALIASES))
                .source(first(cells, SOURCE_ALIASES))
                .build();
    }

    static String canonicalHeader(String header) {
        String h = StringUtils.trimToEmpty(header).toLowerCase(Locale.ROOT);
        if (h.startsWith("col_")) {
            h = h.substring(4);
        }
        h = h.replace('_', ' ').replaceAll("[^a-z0-9/ ]", " ");
        return StringUtils.normalizeSpace(h);
    }

    static boolean isUwFilled(String uw) {
        return StringUtils.isNotBlank(uw) && !"n/a".equalsIgnoreCase(uw.trim());
    }

    static LoanType loanType(String raw) {
        if (raw == null) {
            return LoanType.NEW;
        }
        String latin = StringUtils.normalizeSpace(
                raw.replaceAll("[^\\p{ASCII}]", " ").replace('-', ' ').toLowerCase(Locale.ROOT));
        if (latin.contains("reloan") || latin.contains("re loan")) {
            return LoanType.RELOAN;
        }
        return LoanType.NEW;
    }

    private static Map<String, String> canonicalize(Map<String, ?> row) {
        Map<String, String> cells = new HashMap<>();
        if (row == null) {
            return cells;
        }
        row.forEach((header, value) -> {
            String text = stringify(value);
            if (text != null) {
                cells.putIfAbsent(canonicalHeader(header), text);
            }
        });
        return cells;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return null;
        }
        String text;
        if (value instanceof BigDecimal bd) {
            text = bd.stripTrailingZeros().toPlainString();
        } else if (value instanceof Double || value instanceof Float) {
            text = BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        } else {
            text = value.toString();
        }
        return StringUtils.trimToNull(text);
    }

    private static String first(Map<String, String> cells, List<String> aliases) {
        for (String alias : aliases) {
            String value = cells.get(alias);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
