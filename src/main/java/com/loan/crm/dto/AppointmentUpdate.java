package com.loan.crm.dto;

import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.PartyType;

import java.time.Instant;

/**
 * Result of applying an outcome to one appointment and its lead or borrower, detached from the session.
 *
 * @param changed         true when anything was written
 * @param notifyRejection true when the loan status moved to R during this update
 */
public record AppointmentUpdate(
        Long appointmentId,
        Long partyId,
        String partyName,
        String partyPhone,
        PartyType partyType,
        AppointmentStatus oldStatus,
        AppointmentStatus newStatus,
        LeadStatus oldPartyStatus,
        LeadStatus newPartyStatus,
        LoanCode loanStatus,
        Instant start,
        double hoursSinceStart,
        boolean changed,
        boolean notifyRejection,
        String reason
) {
}
