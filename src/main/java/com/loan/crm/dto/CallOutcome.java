package com.loan.crm.dto;

import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.LoanType;
import com.loan.crm.utils.PhoneNormalizer;
import lombok.Builder;

import java.time.LocalDate;

/**
 * One validated call-sheet row.
 *
 * @param rowDate Singapore date written on the row, null when the row has no date
 */
@Builder
public record CallOutcome(
        int rowNumber,
        String rawPhone,
        String phoneKey,
        String fullName,
        LoanCode code,
        boolean uwFilled,
        LoanType loanType,
        String rawDate,
        LocalDate rowDate,
        String rsReason,
        String rsDetail,
        String email,
        String loanAmount,
        String employmentType,
        String loanPurpose,
        String source
) {

    public String storedPhone() {
        return PhoneNormalizer.toStoredFormat(phoneKey);
    }

    /** The customer showed up: an underwriter picked the file or an outcome code was written. */
    public boolean attended() {
        return uwFilled || code.isKnown();
    }
}
