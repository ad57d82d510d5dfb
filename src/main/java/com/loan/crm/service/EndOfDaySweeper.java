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
 * Settles the final lead status of today's completed appointments from the loan status stored on them.
 */
@Service
public class EndOfDaySweeper {

    private static final Logger log = LoggerFactory.getLogger(EndOfDaySweeper.class);

    private final AppointmentRepository appointmentRepository;
    private final BorrowerAppointmentRepository borrowerAppointmentRepository;
    private final AppointmentService appointmentService;
    private final BorrowerAppointmentService borrowerAppointmentService;
    private final SingaporeClock clock;

    public EndOfDaySweeper(AppointmentRepository appointmentRepository,
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

    public List<ReconciliationAction> sweep() {
        LocalDate today = clock.today();
        Instant from = clock.startOfDay(today);
        Instant to = clock.startOfNextDay(today);
        List<ReconciliationAction> actions = new ArrayList<>();

        for (Long id : appointmentRepository.findIdsByStatusStartingBetween(AppointmentStatus.DONE, from, to)) {
            finalizeOne(id, actions, appointmentService::finalizeLoanStatus);
        }
        for (Long id : borrowerAppointmentRepository.findIdsByStatusStartingBetween(AppointmentStatus.DONE, from, to)) {
            finalizeOne(id, actions, borrowerAppointmentService::finalizeLoanStatus);
        }
        log.info("End-of-day sweep for {}: {} final status updates", today, actions.size());
        return actions;
    }

    private void finalizeOne(Long id, List<ReconciliationAction> actions, Function<Long, AppointmentUpdate> finalizer) {
        try {
            AppointmentUpdate update = finalizer.apply(id);
            if (!update.changed()) {
                return;
            }
            actions.add(ReconciliationAction.builder()
                    .action(ActionKind.FINAL_STATUS_UPDATE)
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
                    .build());
        } catch (ConcurrencyFailureException e) {
            log.warn("Final status of appointment {} lost a concurrent update", id, e);
            actions.add(ReconciliationAction.failure(ActionKind.FINAL_STATUS_UPDATE, null,
                    ErrorKind.CONCURRENT_UPDATE_CONFLICT, "Appointment " + id + ": concurrent update")
                    .toBuilder().appointmentId(id).build());
        }
    }
}
