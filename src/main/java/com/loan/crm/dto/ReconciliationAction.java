package com.loan.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.entity.PartyType;
import com.loan.crm.exception.ErrorKind;
import lombok.Builder;
import lombok.Getter;

/**
 * One line of the run report. Immutable once built.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationAction {

    private final ActionKind action;
    private final boolean success;
    private final String message;
    private final ErrorKind errorKind;
    private final Integer rowNumber;
    private final PartyType partyType;
    private final Long leadId;
    private final String leadName;
    private final Long appointmentId;
    private final AppointmentStatus oldStatus;
    private final AppointmentStatus newStatus;
    private final LeadStatus oldLeadStatus;
    private final LeadStatus newLeadStatus;
    /** Singapore local, yyyy-MM-dd HH:mm. */
    private final String appointmentTime;
    private final Double timeDiffHours;

    public static ReconciliationAction failure(ActionKind action, Integer rowNumber, ErrorKind kind, String message) {
        return ReconciliationAction.builder()
                .action(action)
                .success(false)
                .rowNumber(rowNumber)
                .errorKind(kind)
                .message(message)
                .build();
    }
}
