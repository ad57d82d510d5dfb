package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.AppointmentSnapshot;
import com.loan.crm.dto.AppointmentUpdate;
import com.loan.crm.dto.CallOutcome;
import com.loan.crm.entity.Appointment;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.Lead;
import com.loan.crm.entity.Timeslot;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import com.loan.crm.repository.AppointmentRepository;
import com.loan.crm.repository.LeadRepository;
import com.loan.crm.repository.TimeslotRepository;
import com.loan.crm.service.AppointmentStateMachine.Actor;
import com.loan.crm.service.AppointmentStateMachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Lead appointments. Every write locks the row it changes and keeps the slot counter in step:
 * create allocates, move allocates the new slot and releases the old one, cancel releases.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private final AppointmentRepository appointmentRepository;
    private final LeadRepository leadRepository;
    private final TimeslotRepository timeslotRepository;
    private final TimeslotAllocator allocator;
    private final AppointmentStateMachine stateMachine;
    private final OutcomeApplier applier;
    private final SingaporeClock clock;
    private final String agentId;

    public AppointmentService(AppointmentRepository appointmentRepository,
                              LeadRepository leadRepository,
                              TimeslotRepository timeslotRepository,
                              TimeslotAllocator allocator,
                              AppointmentStateMachine stateMachine,
                              OutcomeApplier applier,
                              SingaporeClock clock,
                              @Value("${crm.reconciliation.agent-id:system-update}") String agentId) {
        this.appointmentRepository = appointmentRepository;
        this.leadRepository = leadRepository;
        this.timeslotRepository = timeslotRepository;
        this.allocator = allocator;
        this.stateMachine = stateMachine;
        this.applier = applier;
        this.clock = clock;
        this.agentId = agentId;
    }

    /** Latest non-cancelled appointment of the lead starting on {@code date}. */
    @Transactional(readOnly = true)
    public Optional<AppointmentSnapshot> findLatestOnDay(Long leadId, LocalDate date) {
        return appointmentRepository.findForLeadBetween(leadId, clock.startOfDay(date), clock.startOfNextDay(date),
                        AppointmentStatus.CANCELLED).stream()
                .findFirst()
                .map(AppointmentService::snapshot);
    }

    @Transactional(readOnly = true)
    public List<AppointmentSnapshot> findUpcoming(Long leadId) {
        return appointmentRepository.findByLeadIdAndStatusOrderByStartDatetimeAsc(leadId, AppointmentStatus.UPCOMING)
                .stream()
                .map(AppointmentService::snapshot)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasNewerAppointment(Long leadId, Long appointmentId) {
        return appointmentRepository.existsNewerThan(leadId, appointmentId, AppointmentStatus.CANCELLED);
    }

    /**
     * Books the lead into {@code slotId} and applies the row outcome to the new appointment.
     *
     * @throws ReconciliationException SLOT_FULL when the slot was taken meanwhile,
     *                                 CONCURRENT_UPDATE_CONFLICT when the lead already has an upcoming appointment
     */
    @Transactional
    public AppointmentUpdate createForLead(Long leadId, Long slotId, CallOutcome outcome) {
        Lead lead = leadRepository.findByIdForUpdate(leadId)
                .orElseThrow(() -> new IllegalArgumentException("Lead " + leadId + " not found"));
        if (appointmentRepository.existsByLeadIdAndStatus(leadId, AppointmentStatus.UPCOMING)) {
            throw new ReconciliationException(ErrorKind.CONCURRENT_UPDATE_CONFLICT,
                    "Lead " + leadId + " already has an upcoming appointment");
        }
        allocator.allocate(slotId);
        Timeslot slot = timeslotRepository.findById(slotId)
                .orElseThrow(() -> ReconciliationException.slotFull(slotId));

        Appointment appointment = Appointment.builder()
                .lead(lead)
                .agentId(agentId)
                .status(AppointmentStatus.UPCOMING)
                .timeslot(slot)
                .startDatetime(clock.toUtc(slot.getSlotDate(), slot.getStartTime()))
                .endDatetime(clock.toUtc(slot.getSlotDate(), slot.getEndTime()))
                .leadSource(lead.getSource())
                .notes("Created from call sheet row " + outcome.rowNumber())
                .createdBy(agentId)
                .updatedBy(agentId)
                .build();
        appointment = appointmentRepository.save(appointment);
        log.info("Booked appointment {} for lead {} in slot {} ({} {})",
                appointment.getId(), leadId, slotId, slot.getSlotDate(), slot.getStartTime());

        AppointmentUpdate applied = applier.applyRowToNewBooking(appointment, lead, outcome, clock.now(), agentId);
        return withOldStatus(applied, null);
    }

    /**
     * Moves an upcoming appointment into {@code slotId}, then applies the row outcome.
     */
    @Transactional
    public AppointmentUpdate moveToSlot(Long appointmentId, Long slotId, CallOutcome outcome) {
        Appointment appointment = lockAppointment(appointmentId);
        if (appointment.getStatus() != AppointmentStatus.UPCOMING) {
            throw new ReconciliationException(ErrorKind.CONCURRENT_UPDATE_CONFLICT,
                    "Appointment " + appointmentId + " is no longer upcoming");
        }
        allocator.allocate(slotId);
        Timeslot previous = appointment.getTimeslot();
        if (previous != null) {
            allocator.release(previous.getId());
        }
        Timeslot slot = timeslotRepository.findById(slotId)
                .orElseThrow(() -> ReconciliationException.slotFull(slotId));
        appointment.setTimeslot(slot);
        appointment.setStartDatetime(clock.toUtc(slot.getSlotDate(), slot.getStartTime()));
        appointment.setEndDatetime(clock.toUtc(slot.getSlotDate(), slot.getEndTime()));
        appointment.setUpdatedBy(agentId);
        log.info("Moved appointment {} from slot {} to slot {}",
                appointmentId, previous != null ? previous.getId() : null, slotId);

        return applier.applyRowToNewBooking(appointment, appointment.getLead(), outcome, clock.now(), agentId);
    }

    @Transactional
    public AppointmentUpdate applyRowOutcome(Long appointmentId, CallOutcome outcome, double thresholdHours) {
        Appointment appointment = lockAppointment(appointmentId);
        return applier.applyRow(appointment, appointment.getLead(), outcome, clock.now(), thresholdHours, agentId);
    }

    @Transactional
    public AppointmentUpdate applyTimeout(Long appointmentId, double thresholdHours) {
        Appointment appointment = lockAppointment(appointmentId);
        return applier.applyTimeout(appointment, appointment.getLead(), clock.now(), thresholdHours, agentId);
    }

    @Transactional
    public AppointmentUpdate finalizeLoanStatus(Long appointmentId) {
        Appointment appointment = lockAppointment(appointmentId);
        return applier.applyFinalStatus(appointment, appointment.getLead(), clock.now(), agentId);
    }

    /**
     * Cancel appointment and give its capacity back.
     */
    @Transactional
    public StatusTransition cancel(Long appointmentId, Actor actor) {
        Appointment appointment = lockAppointment(appointmentId);
        StatusTransition transition = stateMachine.cancel(appointment, actor);
        if (transition.applied()) {
            if (appointment.getTimeslot() != null) {
                allocator.release(appointment.getTimeslot().getId());
            }
            appointment.setUpdatedBy(agentId);
            log.info("Cancelled appointment {} for lead {}", appointmentId, appointment.getLead().getId());
        }
        return transition;
    }

    private Appointment lockAppointment(Long appointmentId) {
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new IllegalArgumentException("Appointment " + appointmentId + " not found"));
    }

    private static AppointmentSnapshot snapshot(Appointment a) {
        return new AppointmentSnapshot(a.getId(), a.getStatus(), a.getStartDatetime());
    }

    private static AppointmentUpdate withOldStatus(AppointmentUpdate u, AppointmentStatus oldStatus) {
        return new AppointmentUpdate(u.appointmentId(), u.partyId(), u.partyName(), u.partyPhone(), u.partyType(),
                oldStatus, u.newStatus(), u.oldPartyStatus(), u.newPartyStatus(), u.loanStatus(), u.start(),
                u.hoursSinceStart(), true, u.notifyRejection(), u.reason());
    }
}
