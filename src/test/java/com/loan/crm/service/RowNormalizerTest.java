package com.loan.crm.service;

import com.loan.crm.dto.CallOutcome;
import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.LoanType;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RowNormalizerTest {

    private final RowNormalizer normalizer = new RowNormalizer();

    @Test
    @DisplayName("Exported sheet headers with col_ prefix are recognised")
    void normalizesExportedRow() {
        // Given
        Map<String, Object> row = new HashMap<>();
        row.put("col_Mobile Number", "+65 9123 4567");
        row.put("col_Code", " rs ");
        row.put("col_UW", "Alice");
        row.put("col_Name", "Tan Ah Kow");
        row.put("col_Date", "21/03/25");
        row.put("col_RS", "Low income");
        row.put("col_RS -Detailed", "Below 1.5k");
        row.put("New or Reloan? ", "Re Loan - 再贷款");

        // When
        CallOutcome outcome = normalizer.normalize(4, row);

        // Then
        assertThat(outcome.rowNumber()).isEqualTo(4);
        assertThat(outcome.phoneKey()).isEqualTo("91234567");
        assertThat(outcome.storedPhone()).isEqualTo("+6591234567");
        assertThat(outcome.code()).isEqualTo(LoanCode.RS);
        assertThat(outcome.uwFilled()).isTrue();
        assertThat(outcome.fullName()).isEqualTo("Tan Ah Kow");
        assertThat(outcome.rowDate()).isEqualTo(LocalDate.of(2025, 3, 21));
        assertThat(outcome.rsReason()).isEqualTo("Low income");
        assertThat(outcome.rsDetail()).isEqualTo("Below 1.5k");
        assertThat(outcome.loanType()).isEqualTo(LoanType.RELOAN);
    }

    @Test
    void headerLookupIgnoresCaseAndSpacing() {
        CallOutcome outcome = normalizer.normalize(1, Map.of("  h/p ", 91234567, "CODE", "p"));

        assertThat(outcome.phoneKey()).isEqualTo("91234567");
        assertThat(outcome.code()).isEqualTo(LoanCode.P);
        assertThat(outcome.uwFilled()).isFalse();
        assertThat(outcome.loanType()).isEqualTo(LoanType.NEW);
        assertThat(outcome.rowDate()).isNull();
    }

    @Test
    void numericPhoneCellIsStringifiedWithoutExponent() {
        CallOutcome outcome = normalizer.normalize(1, Map.of("Phone", 6.591234567E9));

        assertThat(outcome.phoneKey()).isEqualTo("91234567");
    }

    @Test
    void unknownCodeBecomesOther() {
        CallOutcome outcome = normalizer.normalize(1, Map.of("phone_number", "91234567", "Code", "X"));

        assertThat(outcome.code()).isEqualTo(LoanCode.OTHER);
        assertThat(outcome.attended()).isFalse();
    }

    @Test
    void uwMarkedNotApplicableIsNotFilled() {
        CallOutcome outcome = normalizer.normalize(1, Map.of("Phone", "91234567", "UW", " N/A "));

        assertThat(outcome.uwFilled()).isFalse();
    }

    @Test
    void missingPhoneIsInvalid() {
        ReconciliationException e = catchThrowableOfType(
                () -> normalizer.normalize(7, Map.of("Name", "No Phone")), ReconciliationException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_ROW);
        assertThat(e).hasMessageContaining("Row 7");
    }

    @Test
    void foreignPhoneIsInvalid() {
        assertThatThrownBy(() -> normalizer.normalize(1, Map.of("Phone", "+60123456789")))
                .isInstanceOf(ReconciliationException.class)
                .hasMessageContaining("invalid phone");
    }

    @Test
    void unparseableDateIsInvalid() {
        assertThatThrownBy(() -> normalizer.normalize(1, Map.of("Phone", "91234567", "Date", "next monday")))
                .isInstanceOf(ReconciliationException.class)
                .hasMessageContaining("unparseable date");
    }

    @Test
    void canonicalHeaderStripsPrefixAndPunctuation() {
        assertThat(RowNormalizer.canonicalHeader("col_Mobile Number")).isEqualTo("mobile number");
        assertThat(RowNormalizer.canonicalHeader("New or Reloan?")).isEqualTo("new or reloan");
        assertThat(RowNormalizer.canonicalHeader("phone_number")).isEqualTo("phone number");
        assertThat(RowNormalizer.canonicalHeader("col_RS -Detailed")).isEqualTo("rs detailed");
    }

    @Test
    void loanTypeMatchesNewLoanAsNew() {
        assertThat(RowNormalizer.loanType("New Loan")).isEqualTo(LoanType.NEW);
        assertThat(RowNormalizer.loanType("reloan")).isEqualTo(LoanType.RELOAN);
        assertThat(RowNormalizer.loanType("Re-Loan")).isEqualTo(LoanType.RELOAN);
    }
}
