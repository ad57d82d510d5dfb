package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.ActionKind;
import com.loan.crm.dto.AppointmentUpdate;
import com.loan.crm.dto.ReconciliationAction;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.repository.AppointmentRepository;
import com.loan.crm.repository.BorrowerAppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Marks today's upcoming appointments missed once they are overdue; the lead or borrower goes to
 * follow_up so an agent can call back.
 */
@Service
public class TimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSweeper.class);

    private final AppointmentRepository appointmentRepository;
    private final BorrowerAppointmentRepository borrowerAppointmentRepository;
    private final AppointmentService appointmentService;
    private final BorrowerAppointmentService borrowerAppointmentService;
    private final SingaporeClock clock;

    public TimeoutSweeper(AppointmentRepository appointmentRepository,
                          BorrowerAppointmentRepository borrowerAppointmentRepository,
                          AppointmentService appointmentService,
                          BorrowerAppointmentService borrowerAppointmentService,
                          SingaporeClock clock) {
        this.appointmentRepository = appointmentRepository;
        this.borrowerAppointmentRepository = borrowerAppointmentRepository;
        this.appointmentService = appointmentService;
        this.borrowerAppointmentService = borrowerAppointmentService;
        this.clock = clock;
    }

    public List<ReconciliationAction> sweep(double thresholdHours) {
        LocalDate today = clock.today();
        Instant from = clock.startOfDay(today);
        Instant to = clock.startOfNextDay(today);
        List<ReconciliationAction> actions = new ArrayList<>();

        List<Long> leadAppointments = appointmentRepository
                .findIdsByStatusStartingBetween(AppointmentStatus.UPCOMING, from, to);
        for (Long id : leadAppointments) {
            sweepOne(id, actions, appointmentId -> appointmentService.applyTimeout(appointmentId, thresholdHours));
        }
        List<Long> borrowerAppointments = borrowerAppointmentRepository
                .findIdsByStatusStartingBetween(AppointmentStatus.UPCOMING, from, to);
        for (Long id : borrowerAppointments) {
            sweepOne(id, actions, appointmentId -> borrowerAppointmentService.applyTimeout(appointmentId, thresholdHours));
        }
        log.info("Timeout sweep for {}: {} lead and {} borrower appointments checked, {} marked missed",
                today, leadAppointments.size(), borrowerAppointments.size(), actions.stream().filter(ReconciliationAction::isSuccess).count());
        return actions;
    }

    private void sweepOne(Long id, List<ReconciliationAction> actions, Function<Long, AppointmentUpdate> timeout) {
        try {
            AppointmentUpdate update = timeout.apply(id);
            if (update.changed()) {
                actions.add(ReconciliationAction.builder()
                        .action(ActionKind.TIMEOUT_APPOINTMENT)
                        .success(true)
                        .message(update.reason())
                        .partyType(update.partyType())
                        .leadId(update.partyId())
                        .leadName(update.partyName())
                        .appointmentId(update.appointmentId())
                        .oldStatus(update.oldStatus())
                        .newStatus(update.newStatus())
                        .oldLeadStatus(update.oldPartyStatus())
                        .newLeadStatus(update.newPartyStatus())
                        .appointmentTime(clock.format(update.start()))
                        .timeDiffHours(Math.round(update.hoursSinceStart() * 100) / 100d)
                        .build());
            }
        } catch (ConcurrencyFailureException e) {
            log.warn("Timeout of appointment {} lost a concurrent update", id, e);
            actions.add(ReconciliationAction.failure(ActionKind.TIMEOUT_APPOINTMENT, null,
                    ErrorKind.CONCURRENT_UPDATE_CONFLICT, "Appointment " + id + ": concurrent update")
                    .toBuilder().appointmentId(id).build());
        }
    }
}
