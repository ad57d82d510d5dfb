package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.AppointmentSnapshot;
import com.loan.crm.dto.AppointmentUpdate;
import com.loan.crm.dto.CallOutcome;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.BorrowerAppointment;
import com.loan.crm.repository.BorrowerAppointmentRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Reloan appointments of existing borrowers. Same rules as lead appointments; the engine never books
 * or moves them.
 */
@Service
public class BorrowerAppointmentService {

    private final BorrowerAppointmentRepository repository;
    private final OutcomeApplier applier;
    private final SingaporeClock clock;
    private final String agentId;

    public BorrowerAppointmentService(BorrowerAppointmentRepository repository,
                                      OutcomeApplier applier,
                                      SingaporeClock clock,
                                      @Value("${crm.reconciliation.agent-id:system-update}") String agentId) {
        this.repository = repository;
        this.applier = applier;
        this.clock = clock;
        this.agentId = agentId;
    }

    @Transactional(readOnly = true)
    public Optional<AppointmentSnapshot> findLatestOnDay(Long borrowerId, LocalDate date) {
        return repository.findForBorrowerBetween(borrowerId, clock.startOfDay(date), clock.startOfNextDay(date),
                        AppointmentStatus.CANCELLED).stream()
                .findFirst()
                .map(a -> new AppointmentSnapshot(a.getId(), a.getStatus(), a.getStartDatetime()));
    }

    @Transactional
    public AppointmentUpdate applyRowOutcome(Long appointmentId, CallOutcome outcome, double thresholdHours) {
        BorrowerAppointment appointment = lock(appointmentId);
        return applier.applyRow(appointment, appointment.getBorrower(), outcome, clock.now(), thresholdHours, agentId);
    }

    @Transactional
    public AppointmentUpdate applyTimeout(Long appointmentId, double thresholdHours) {
        BorrowerAppointment appointment = lock(appointmentId);
        return applier.applyTimeout(appointment, appointment.getBorrower(), clock.now(), thresholdHours, agentId);
    }

    @Transactional
    public AppointmentUpdate finalizeLoanStatus(Long appointmentId) {
        BorrowerAppointment appointment = lock(appointmentId);
        return applier.applyFinalStatus(appointment, appointment.getBorrower(), clock.now(), agentId);
    }

    private BorrowerAppointment lock(Long appointmentId) {
        return repository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new IllegalArgumentException("Borrower appointment " + appointmentId + " not found"));
    }
}
