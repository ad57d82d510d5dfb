package com.loan.crm.service;

import com.loan.crm.dto.AppointmentUpdate;
import com.loan.crm.dto.CallOutcome;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.EngineLeadStatus;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.TrackedAppointment;
import com.loan.crm.entity.TrackedParty;
import com.loan.crm.service.AppointmentStateMachine.Actor;
import com.loan.crm.service.AppointmentStateMachine.StatusTransition;
import com.loan.crm.service.LeadStatusProjector.MissPolicy;
import com.loan.crm.service.LeadStatusProjector.Projection;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes a projection onto a managed appointment and its lead or borrower.
 * Callers hold the appointment row lock and the surrounding transaction.
 */
@Component
public class OutcomeApplier {

    private final LeadStatusProjector projector;
    private final AppointmentStateMachine stateMachine;

    public OutcomeApplier(LeadStatusProjector projector, AppointmentStateMachine stateMachine) {
        this.projector = projector;
        this.stateMachine = stateMachine;
    }

    public AppointmentUpdate applyRow(TrackedAppointment appointment, TrackedParty party, CallOutcome outcome,
                                      Instant now, double thresholdHours, String actor) {
        double hours = AppointmentStateMachine.hoursBetween(appointment.getStartDatetime(), now);
        Optional<Projection> projection = projector.project(outcome.code(), outcome.uwFilled(),
                hours >= thresholdHours, MissPolicy.FINAL, outcome.rsReason(), outcome.rsDetail());
        if (projection.isEmpty()) {
            return unchanged(appointment, party, hours,
                    String.format("Within threshold (%.2fh since start, threshold %.2fh)", hours, thresholdHours));
        }
        return apply(appointment, party, projection.get(), hours, actor);
    }

    /**
     * Applies the row to an appointment this same row just booked or moved. Only the code and UW
     * count here: a slot that started earlier today is no evidence of a no-show.
     */
    public AppointmentUpdate applyRowToNewBooking(TrackedAppointment appointment, TrackedParty party,
                                                  CallOutcome outcome, Instant now, String actor) {
        double hours = AppointmentStateMachine.hoursBetween(appointment.getStartDatetime(), now);
        Optional<Projection> projection = projector.project(outcome.code(), outcome.uwFilled(),
                false, MissPolicy.FINAL, outcome.rsReason(), outcome.rsDetail());
        if (projection.isEmpty()) {
            return unchanged(appointment, party, hours, "Booked, awaiting outcome");
        }
        return apply(appointment, party, projection.get(), hours, actor);
    }

    public AppointmentUpdate applyTimeout(TrackedAppointment appointment, TrackedParty party,
                                          Instant now, double thresholdHours, String actor) {
        double hours = AppointmentStateMachine.hoursBetween(appointment.getStartDatetime(), now);
        AppointmentStatus oldStatus = appointment.getStatus();
        LeadStatus oldPartyStatus = party.getStatus();
        StatusTransition transition = stateMachine.markMissedIfOverdue(appointment, now, thresholdHours);
        if (!transition.applied()) {
            return unchanged(appointment, party, hours, transition.reason());
        }
        Projection miss = projector.projectRecoverableMiss();
        party.applyEngineStatus(miss.leadStatus());
        appointment.setUpdatedBy(actor);
        party.setUpdatedBy(actor);
        return update(appointment, party, oldStatus, oldPartyStatus, hours, true, false,
                String.format("No show for %.2fh", hours));
    }

    public AppointmentUpdate applyFinalStatus(TrackedAppointment appointment, TrackedParty party,
                                              Instant now, String actor) {
        double hours = AppointmentStateMachine.hoursBetween(appointment.getStartDatetime(), now);
        Optional<EngineLeadStatus> target = projector.projectPersistedLoanStatus(appointment.getLoanStatus());
        if (target.isEmpty()) {
            return unchanged(appointment, party, hours, "No loan status recorded");
        }
        LeadStatus oldPartyStatus = party.getStatus();
        if (oldPartyStatus == target.get().toLeadStatus()) {
            return unchanged(appointment, party, hours, "Already " + oldPartyStatus.getValue());
        }
        party.applyEngineStatus(target.get());
        party.setUpdatedBy(actor);
        return update(appointment, party, appointment.getStatus(), oldPartyStatus, hours, true, false,
                "Final status from loan status " + appointment.getLoanStatus());
    }

    private AppointmentUpdate apply(TrackedAppointment appointment, TrackedParty party, Projection projection,
                                    double hours, String actor) {
        AppointmentStatus oldStatus = appointment.getStatus();
        LeadStatus oldPartyStatus = party.getStatus();
        LoanCode oldLoanStatus = appointment.getLoanStatus();
        AppointmentStatus target = projection.appointmentStatus();

        if (oldStatus == AppointmentStatus.CANCELLED) {
            return unchanged(appointment, party, hours, "Appointment is cancelled");
        }
        if (oldStatus == AppointmentStatus.DONE && target == AppointmentStatus.MISSED) {
            return unchanged(appointment, party, hours, "Appointment already done");
        }

        boolean changed = false;
        if (oldStatus == AppointmentStatus.MISSED && target == AppointmentStatus.DONE) {
            stateMachine.reopen(appointment);
        }
        StatusTransition transition = stateMachine.transition(appointment, target, Actor.ENGINE);
        changed |= transition.applied() || appointment.getStatus() != oldStatus;

        if (projection.loanStatus() != null) {
            String notes = projection.loanNotes();
            if (projection.loanStatus() != oldLoanStatus) {
                changed = true;
            }
            appointment.setLoanStatus(projection.loanStatus());
            appointment.setLoanNotes(notes);
            if (projection.loanStatus() != party.getLoanStatus()) {
                changed = true;
            }
            party.setLoanStatus(projection.loanStatus());
            party.setLoanNotes(notes);
        }

        if (party.getStatus() != projection.leadStatus().toLeadStatus()) {
            party.applyEngineStatus(projection.leadStatus());
            changed = true;
        }

        if (changed) {
            appointment.setUpdatedBy(actor);
            party.setUpdatedBy(actor);
        }
        boolean notify = projection.notifies() && oldLoanStatus != LoanCode.R;
        return update(appointment, party, oldStatus, oldPartyStatus, hours, changed, notify,
                changed ? projection.reason() : "No change");
    }

    private AppointmentUpdate unchanged(TrackedAppointment appointment, TrackedParty party, double hours, String reason) {
        return update(appointment, party, appointment.getStatus(), party.getStatus(), hours, false, false, reason);
    }

    private AppointmentUpdate update(TrackedAppointment appointment, TrackedParty party,
                                     AppointmentStatus oldStatus, LeadStatus oldPartyStatus,
                                     double hours, boolean changed, boolean notify, String reason) {
        return new AppointmentUpdate(
                appointment.getId(),
                party.getId(),
                party.getFullName(),
                party.getPhoneNumber(),
                party.partyType(),
                oldStatus,
                appointment.getStatus(),
                oldPartyStatus,
                party.getStatus(),
                appointment.getLoanStatus(),
                appointment.getStartDatetime(),
                hours,
                changed || !Objects.equals(oldStatus, appointment.getStatus()),
                notify,
                reason);
    }
}
