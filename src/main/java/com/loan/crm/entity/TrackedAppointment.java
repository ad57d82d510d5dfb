package com.loan.crm.entity;

import java.time.Instant;

/**
 * Common view of lead and borrower appointments used by the state machine.
 */
public interface TrackedAppointment {

    Long getId();

    AppointmentStatus getStatus();

    /**
     * Writes the status without validation. Callers go through
     * {@code AppointmentStateMachine} so that the transition table is honoured.
     */
    void applyStatus(AppointmentStatus status);

    Instant getStartDatetime();

    LoanCode getLoanStatus();

    void setLoanStatus(LoanCode loanStatus);

    void setLoanNotes(String loanNotes);

    void setUpdatedBy(String updatedBy);
}
