package com.loan.crm.service;

import com.loan.crm.dto.ActionKind;
import com.loan.crm.dto.EligibilityResult;
import com.loan.crm.dto.NotificationPayload;
import com.loan.crm.dto.ReconciliationAction;
import com.loan.crm.dto.RunMode;
import com.loan.crm.dto.RunSummary;
import com.loan.crm.entity.Appointment;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.Borrower;
import com.loan.crm.entity.BorrowerAppointment;
import com.loan.crm.entity.Lead;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.entity.LoanCode;
import com.loan.crm.entity.Timeslot;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import com.loan.crm.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationOrchestratorIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private BatchRunner batchRunner;

    @SafeVarargs
    private RunSummary live(Map<String, Object>... rows) {
        return batchRunner.run(List.of(rows), RunMode.LIVE, null);
    }

    @Test
    @DisplayName("A: unknown phone with code P creates the lead and a completed appointment")
    void newLeadWithCodeP() {
        // Given
        Timeslot noon = slot(TODAY, LocalTime.NOON, 1, 0);
        slot(TODAY, LocalTime.of(12, 30), 1, 0);

        // When
        RunSummary summary = live(Map.of("Mobile Number", "91234567", "Code", "P", "UW", "Alice", "Name", "Tan Ah Kow"));

        // Then
        assertThat(summary.successCount()).isEqualTo(1);
        assertThat(summary.actions()).extracting(ReconciliationAction::getAction)
                .containsExactly(ActionKind.CREATE_LEAD, ActionKind.CREATE_APPOINTMENT);
        ReconciliationAction booked = summary.actions().get(1);
        assertThat(booked.isSuccess()).isTrue();
        assertThat(booked.getNewStatus()).isEqualTo(AppointmentStatus.DONE);
        assertThat(booked.getNewLeadStatus()).isEqualTo(LeadStatus.DONE);
        assertThat(booked.getAppointmentTime()).isEqualTo("2025-03-21 12:00");

        Lead lead = leadRepository.findAll().get(0);
        assertThat(lead.getPhoneNumber()).isEqualTo("+6591234567");
        assertThat(lead.getSource()).isEqualTo("SEO");
        assertThat(lead.getStatus()).isEqualTo(LeadStatus.DONE);
        assertThat(lead.getLoanStatus()).isEqualTo(LoanCode.P);
        assertThat(lead.getEligibilityStatus()).isEqualTo(Lead.ELIGIBLE);
        assertThat(timeslotRepository.findOccupiedCount(noon.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("D: RS on today's upcoming appointment completes it and misses the lead")
    void rsOnTodaysAppointment() {
        Lead lead = lead("+6591234567", "Tan");
        Timeslot ten = slot(TODAY, LocalTime.of(10, 0), 1, 1);
        Appointment appointment = appointment(lead, ten, AppointmentStatus.UPCOMING);

        RunSummary summary = live(Map.of("col_Mobile Number", "6591234567", "col_Code", "RS",
                "col_RS", "Low income", "col_RS -Detailed", "Below 1.5k"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.UPDATE_APPOINTMENT);
        assertThat(action.getOldStatus()).isEqualTo(AppointmentStatus.UPCOMING);
        assertThat(action.getNewStatus()).isEqualTo(AppointmentStatus.DONE);
        assertThat(action.getNewLeadStatus()).isEqualTo(LeadStatus.MISSED_RS);
        assertThat(action.getTimeDiffHours()).isEqualTo(2.0);

        Appointment stored = appointmentRepository.findById(appointment.getId()).orElseThrow();
        assertThat(stored.getLoanStatus()).isEqualTo(LoanCode.RS);
        assertThat(stored.getLoanNotes()).isEqualTo("RS - Low income\nRS Details: Below 1.5k");
        assertThat(leadRepository.findById(lead.getId()).orElseThrow().getStatus()).isEqualTo(LeadStatus.MISSED_RS);
        assertThat(timeslotRepository.findOccupiedCount(ten.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("Submitting the same row twice leaves the data as after the first run")
    void resubmitIsIdempotent() {
        Timeslot noon = slot(TODAY, LocalTime.NOON, 2, 0);
        Map<String, Object> row = Map.of("Mobile Number", "91234567", "Code", "PRS");

        live(row);
        RunSummary second = live(row);

        assertThat(second.actions()).extracting(ReconciliationAction::getAction)
                .containsExactly(ActionKind.UPDATE_APPOINTMENT);
        assertThat(second.actions().get(0).getMessage()).isEqualTo("No change");
        assertThat(leadRepository.count()).isEqualTo(1);
        assertThat(appointmentRepository.count()).isEqualTo(1);
        assertThat(timeslotRepository.findOccupiedCount(noon.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("A lead stored with spaces in its phone is matched instead of duplicated")
    void formattedStoredPhoneIsMatched() {
        Lead lead = lead("+65 9123 4567", "Tan");
        slot(TODAY, LocalTime.NOON, 1, 0);

        RunSummary summary = live(Map.of("Mobile Number", "91234567", "Code", "P"));

        assertThat(summary.actions()).extracting(ReconciliationAction::getAction)
                .containsExactly(ActionKind.CREATE_APPOINTMENT);
        assertThat(summary.actions().get(0).getLeadId()).isEqualTo(lead.getId());
        assertThat(leadRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("A new lead booked into an earlier slot today is not marked missed")
    void bookingIntoEarlierSlotIsNotAMiss() {
        Timeslot morning = slot(TODAY, LocalTime.of(8, 30), 1, 0);
        slot(TODAY, LocalTime.NOON, 1, 1);

        RunSummary summary = live(Map.of("Mobile Number", "81234567", "Name", "New Person"));

        ReconciliationAction booked = summary.actions().get(1);
        assertThat(booked.isSuccess()).isTrue();
        assertThat(booked.getAppointmentTime()).isEqualTo("2025-03-21 08:30");
        assertThat(booked.getNewStatus()).isEqualTo(AppointmentStatus.UPCOMING);
        assertThat(booked.getNewLeadStatus()).isEqualTo(LeadStatus.NEW);
        assertThat(timeslotRepository.findOccupiedCount(morning.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("A fully booked day creates the lead but no appointment")
    void fullyBooked() {
        Timeslot noon = slot(TODAY, LocalTime.NOON, 1, 1);

        RunSummary summary = live(Map.of("Mobile Number", "91234567", "Code", "P"));

        assertThat(summary.errorCount()).isEqualTo(1);
        assertThat(summary.actions().get(0).isSuccess()).isTrue();
        ReconciliationAction failed = summary.actions().get(1);
        assertThat(failed.getAction()).isEqualTo(ActionKind.CREATE_APPOINTMENT);
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getErrorKind()).isEqualTo(ErrorKind.NO_SLOT_AVAILABLE);
        assertThat(leadRepository.count()).isEqualTo(1);
        assertThat(appointmentRepository.count()).isZero();
        assertThat(timeslotRepository.findOccupiedCount(noon.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("Duplicate rows in one batch never give a lead two upcoming appointments")
    void duplicateRowsKeepOneUpcoming() {
        slot(TODAY, LocalTime.NOON, 1, 0);
        slot(TODAY, LocalTime.of(12, 30), 1, 0);
        Map<String, Object> row = Map.of("Mobile Number", "81234567", "Name", "Lim");

        RunSummary summary = live(row, row);

        assertThat(summary.actions()).extracting(ReconciliationAction::getAction)
                .containsExactly(ActionKind.CREATE_LEAD, ActionKind.CREATE_APPOINTMENT, ActionKind.UPDATE_APPOINTMENT);
        Lead lead = leadRepository.findAll().get(0);
        assertThat(appointmentRepository.countByLeadIdAndStatus(lead.getId(), AppointmentStatus.UPCOMING)).isEqualTo(1);
    }

    @Test
    @DisplayName("C: an upcoming appointment on another day is moved to today")
    void upcomingOnAnotherDayIsMoved() {
        Lead lead = lead("91234567", "Tan");
        Timeslot monday = slot(TODAY.plusDays(3), LocalTime.of(10, 0), 1, 1);
        Timeslot noon = slot(TODAY, LocalTime.NOON, 1, 0);
        Appointment appointment = appointment(lead, monday, AppointmentStatus.UPCOMING);

        RunSummary summary = live(Map.of("Phone", "91234567", "UW", "Bob"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.MOVE_APPOINTMENT);
        assertThat(action.getAppointmentId()).isEqualTo(appointment.getId());
        assertThat(action.getNewStatus()).isEqualTo(AppointmentStatus.DONE);
        assertThat(timeslotRepository.findOccupiedCount(monday.getId())).isZero();
        assertThat(timeslotRepository.findOccupiedCount(noon.getId())).isEqualTo(1);
        assertThat(appointmentRepository.findById(appointment.getId()).orElseThrow().getStartDatetime())
                .isEqualTo(clock.toUtc(TODAY, LocalTime.NOON));
    }

    @Test
    @DisplayName("B: a known lead without appointments is booked today")
    void knownLeadIsBooked() {
        Lead lead = lead("+6591234567", "Tan");
        slot(TODAY, LocalTime.of(13, 0), 1, 0);

        RunSummary summary = live(Map.of("Phone", "91234567"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.CREATE_APPOINTMENT);
        assertThat(action.getLeadId()).isEqualTo(lead.getId());
        assertThat(action.getNewStatus()).isEqualTo(AppointmentStatus.UPCOMING);
        verify(eligibilityChecker, never()).check(anyString(), any());
    }

    @Test
    void ineligibleLeadIsNotBooked() {
        slot(TODAY, LocalTime.NOON, 1, 0);
        when(eligibilityChecker.check(anyString(), any())).thenReturn(EligibilityResult.ineligible("Found in lists: blacklist"));

        RunSummary summary = live(Map.of("Phone", "91234567", "Code", "P"));

        assertThat(summary.actions()).extracting(ReconciliationAction::getAction).containsExactly(ActionKind.CREATE_LEAD);
        assertThat(summary.actions().get(0).getMessage()).contains("not eligible");
        assertThat(leadRepository.findAll().get(0).getEligibilityStatus()).isEqualTo(Lead.INELIGIBLE);
        assertThat(appointmentRepository.count()).isZero();
    }

    @Test
    void eligibilityFailureKeepsTheLead() {
        slot(TODAY, LocalTime.NOON, 1, 0);
        when(eligibilityChecker.check(anyString(), any()))
                .thenThrow(new ReconciliationException(ErrorKind.ELIGIBILITY_CHECK_FAILED, "timeout"));

        RunSummary summary = live(Map.of("Phone", "91234567"));

        assertThat(summary.actions()).hasSize(2);
        assertThat(summary.actions().get(0).isSuccess()).isTrue();
        assertThat(summary.actions().get(1).getErrorKind()).isEqualTo(ErrorKind.ELIGIBILITY_CHECK_FAILED);
        assertThat(leadRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Code R sends one rejection notification")
    void rejectionIsNotified() {
        Lead lead = lead("+6591234567", "Tan");
        Timeslot ten = slot(TODAY, LocalTime.of(10, 0), 1, 1);
        Appointment appointment = appointment(lead, ten, AppointmentStatus.UPCOMING);

        live(Map.of("Phone", "91234567", "Code", "R"));
        live(Map.of("Phone", "91234567", "Code", "R"));

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(notificationSink).send(payload.capture());
        assertThat(payload.getValue().leadId()).isEqualTo(lead.getId());
        assertThat(payload.getValue().appointmentId()).isEqualTo(appointment.getId());
        assertThat(payload.getValue().code()).isEqualTo("R");
        assertThat(leadRepository.findById(lead.getId()).orElseThrow().getStatus()).isEqualTo(LeadStatus.DONE);
    }

    @Test
    void notificationFailureDoesNotFailTheAction() {
        Lead lead = lead("+6591234567", "Tan");
        appointment(lead, slot(TODAY, LocalTime.of(10, 0), 1, 1), AppointmentStatus.UPCOMING);
        doThrow(new ReconciliationException(ErrorKind.EXTERNAL_NOTIFY_FAILED, "503"))
                .when(notificationSink).send(any());

        RunSummary summary = live(Map.of("Phone", "91234567", "Code", "R"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.isSuccess()).isTrue();
        assertThat(action.getMessage()).contains("notification failed");
    }

    @Test
    @DisplayName("A missed appointment with no newer booking is reopened when the customer turns up")
    void missedAppointmentIsReopened() {
        Lead lead = lead("+6591234567", "Tan");
        Appointment appointment = appointment(lead, slot(TODAY, LocalTime.of(9, 0), 1, 1), AppointmentStatus.MISSED);

        RunSummary summary = live(Map.of("Phone", "91234567", "UW", "Alice"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.UPDATE_APPOINTMENT);
        assertThat(action.getAppointmentId()).isEqualTo(appointment.getId());
        assertThat(action.getOldStatus()).isEqualTo(AppointmentStatus.MISSED);
        assertThat(action.getNewStatus()).isEqualTo(AppointmentStatus.DONE);
    }

    @Test
    @DisplayName("Attendance after a superseded miss goes to the newer booking")
    void attendanceAfterSupersededMissMovesNewerBooking() {
        Lead lead = lead("+6591234567", "Tan");
        Appointment missed = appointment(lead, slot(TODAY, LocalTime.of(9, 0), 1, 1), AppointmentStatus.MISSED);
        Timeslot nextWeek = slot(TODAY.plusDays(7), LocalTime.of(10, 0), 1, 1);
        Appointment rebooked = appointment(lead, nextWeek, AppointmentStatus.UPCOMING);
        slot(TODAY, LocalTime.NOON, 1, 0);

        RunSummary summary = live(Map.of("Phone", "91234567", "Code", "P"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.MOVE_APPOINTMENT);
        assertThat(action.getAppointmentId()).isEqualTo(rebooked.getId());
        assertThat(appointmentRepository.findById(missed.getId()).orElseThrow().getStatus())
                .isEqualTo(AppointmentStatus.MISSED);
        assertThat(timeslotRepository.findOccupiedCount(nextWeek.getId())).isZero();
    }

    @Test
    @DisplayName("Reloan rows update the borrower's appointment today")
    void reloanUpdatesBorrowerAppointment() {
        Borrower borrower = borrower("+6581234567", "Lee");
        BorrowerAppointment appointment = borrowerAppointment(borrower, TODAY, LocalTime.of(11, 0), AppointmentStatus.UPCOMING);

        RunSummary summary = live(Map.of("Phone", "81234567", "New or Reloan?", "Reloan", "Code", "P"));

        ReconciliationAction action = summary.actions().get(0);
        assertThat(action.getAction()).isEqualTo(ActionKind.UPDATE_BORROWER_APPOINTMENT);
        assertThat(action.getAppointmentId()).isEqualTo(appointment.getId());
        assertThat(borrowerRepository.findById(borrower.getId()).orElseThrow().getStatus()).isEqualTo(LeadStatus.DONE);
        assertThat(borrowerAppointmentRepository.findById(appointment.getId()).orElseThrow().getStatus())
                .isEqualTo(AppointmentStatus.DONE);
        assertThat(leadRepository.count()).isZero();
    }

    @Test
    void softDeletedLeadsAreIgnored() {
        Lead deleted = lead("+6591234567", "Gone");
        deleted.setDeleted(true);
        leadRepository.save(deleted);
        slot(TODAY, LocalTime.NOON, 1, 0);

        RunSummary summary = live(Map.of("Phone", "91234567"));

        assertThat(summary.actions().get(0).getAction()).isEqualTo(ActionKind.CREATE_LEAD);
        assertThat(leadRepository.count()).isEqualTo(2);
    }
}
