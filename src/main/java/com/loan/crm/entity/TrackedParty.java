package com.loan.crm.entity;

/**
 * A lead or borrower whose pipeline status follows its appointments.
 */
public interface TrackedParty {

    Long getId();

    String getFullName();

    String getPhoneNumber();

    LeadStatus getStatus();

    void applyEngineStatus(EngineLeadStatus status);

    LoanCode getLoanStatus();

    void setLoanStatus(LoanCode loanStatus);

    void setLoanNotes(String loanNotes);

    void setUpdatedBy(String updatedBy);

    PartyType partyType();
}
