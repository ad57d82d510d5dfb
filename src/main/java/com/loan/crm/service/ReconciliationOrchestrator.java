package com.loan.crm.service;

import com.loan.crm.component.PhoneLockRegistry;
import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.ActionKind;
import com.loan.crm.dto.AppointmentSnapshot;
import com.loan.crm.dto.AppointmentUpdate;
import com.loan.crm.dto.CallOutcome;
import com.loan.crm.dto.EligibilityResult;
import com.loan.crm.dto.NotificationPayload;
import com.loan.crm.dto.ReconciliationAction;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.Borrower;
import com.loan.crm.entity.Lead;
import com.loan.crm.entity.LoanType;
import com.loan.crm.entity.PartyType;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives one call outcome through the lead and appointment state machines.
 *
 * <ul>
 *   <li>A: unknown phone, create the lead, check eligibility, book today</li>
 *   <li>B: known lead without appointments today or upcoming, book today</li>
 *   <li>C: known lead with an upcoming appointment on another day, move it to today</li>
 *   <li>D: known lead with an appointment today, apply the outcome to it</li>
 * </ul>
 * Reloan rows go to the borrower's appointment today when there is one.
 * Each step commits on its own; a failure in a later step does not undo an earlier one.
 */
@Service
public class ReconciliationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationOrchestrator.class);

    private final PhoneMatcher phoneMatcher;
    private final LeadService leadService;
    private final AppointmentService appointmentService;
    private final BorrowerAppointmentService borrowerAppointmentService;
    private final TimeslotAllocator allocator;
    private final EligibilityChecker eligibilityChecker;
    private final NotificationSink notificationSink;
    private final PhoneLockRegistry lockRegistry;
    private final SingaporeClock clock;
    private final int lookaheadDays;

    public ReconciliationOrchestrator(PhoneMatcher phoneMatcher,
                                      LeadService leadService,
                                      AppointmentService appointmentService,
                                      BorrowerAppointmentService borrowerAppointmentService,
                                      TimeslotAllocator allocator,
                                      EligibilityChecker eligibilityChecker,
                                      NotificationSink notificationSink,
                                      PhoneLockRegistry lockRegistry,
                                      SingaporeClock clock,
                                      @Value("${crm.reconciliation.slot-lookahead-days:0}") int lookaheadDays) {
        this.phoneMatcher = phoneMatcher;
        this.leadService = leadService;
        this.appointmentService = appointmentService;
        this.borrowerAppointmentService = borrowerAppointmentService;
        this.allocator = allocator;
        this.eligibilityChecker = eligibilityChecker;
        this.notificationSink = notificationSink;
        this.lockRegistry = lockRegistry;
        this.clock = clock;
        this.lookaheadDays = lookaheadDays;
    }

    public List<ReconciliationAction> reconcile(CallOutcome outcome, double thresholdHours) {
        return lockRegistry.withLock(outcome.phoneKey(), () -> reconcileLocked(outcome, thresholdHours));
    }

    private List<ReconciliationAction> reconcileLocked(CallOutcome outcome, double thresholdHours) {
        LocalDate today = clock.today();

        if (outcome.loanType() == LoanType.RELOAN) {
            Optional<Borrower> borrower = phoneMatcher.findBorrower(outcome.phoneKey());
            if (borrower.isPresent()) {
                Optional<AppointmentSnapshot> todays =
                        borrowerAppointmentService.findLatestOnDay(borrower.get().getId(), today);
                if (todays.isPresent()) {
                    return List.of(step(ActionKind.UPDATE_BORROWER_APPOINTMENT, outcome, () -> toAction(
                            ActionKind.UPDATE_BORROWER_APPOINTMENT, outcome,
                            borrowerAppointmentService.applyRowOutcome(todays.get().id(), outcome, thresholdHours))));
                }
                log.debug("Borrower {} has no appointment today, falling back to leads", borrower.get().getId());
            }
        }

        Optional<Lead> found = phoneMatcher.findLead(outcome.phoneKey());
        if (found.isEmpty()) {
            return createLeadAndBook(outcome, today);
        }
        Lead lead = found.get();

        Optional<AppointmentSnapshot> todays = appointmentService.findLatestOnDay(lead.getId(), today);
        if (todays.isPresent()) {
            return List.of(updateToday(lead, todays.get(), outcome, thresholdHours, today));
        }

        List<AppointmentSnapshot> upcoming = appointmentService.findUpcoming(lead.getId());
        if (!upcoming.isEmpty()) {
            return List.of(move(upcoming.get(0), outcome, today));
        }
        return List.of(book(lead, outcome, today));
    }

    private List<ReconciliationAction> createLeadAndBook(CallOutcome outcome, LocalDate today) {
        List<ReconciliationAction> actions = new ArrayList<>();
        Lead lead;
        try {
            lead = leadService.createFromOutcome(outcome);
        } catch (DataAccessException e) {
            rethrowIfStorageDown(e);
            log.error("Could not create lead for row {}", outcome.rowNumber(), e);
            actions.add(ReconciliationAction.failure(ActionKind.CREATE_LEAD, outcome.rowNumber(),
                    ErrorKind.STORAGE_FAILURE, "Could not create lead: " + e.getMostSpecificCause().getMessage()));
            return actions;
        }

        EligibilityResult eligibility;
        try {
            eligibility = eligibilityChecker.check(outcome.phoneKey(), outcome.fullName());
        } catch (ReconciliationException e) {
            actions.add(leadCreated(lead, outcome, "Lead created; eligibility not checked"));
            actions.add(ReconciliationAction.failure(ActionKind.CREATE_APPOINTMENT, outcome.rowNumber(),
                    e.getKind(), e.getMessage()).toBuilder().leadId(lead.getId()).leadName(lead.getFullName()).build());
            return actions;
        }
        lead = leadService.recordEligibility(lead.getId(), eligibility);
        if (!eligibility.eligible()) {
            log.info("Lead {} not eligible: {}", lead.getId(), eligibility.notes());
            actions.add(leadCreated(lead, outcome, "Lead created, not eligible: " + eligibility.notes()));
            return actions;
        }
        actions.add(leadCreated(lead, outcome, "Lead created"));
        actions.add(book(lead, outcome, today));
        return actions;
    }

    private ReconciliationAction book(Lead lead, CallOutcome outcome, LocalDate today) {
        if (lead.isIneligible()) {
            return ReconciliationAction.failure(ActionKind.CREATE_APPOINTMENT, outcome.rowNumber(),
                    ErrorKind.NOT_ELIGIBLE, "Lead " + lead.getId() + " is not eligible: " + lead.getEligibilityNotes())
                    .toBuilder().leadId(lead.getId()).leadName(lead.getFullName()).build();
        }
        Long leadId = lead.getId();
        return step(ActionKind.CREATE_APPOINTMENT, outcome, () -> toAction(ActionKind.CREATE_APPOINTMENT, outcome,
                allocator.bookNearest(today, clock.timeOfDay(), lookaheadDays,
                        slotId -> appointmentService.createForLead(leadId, slotId, outcome))));
    }

    private ReconciliationAction move(AppointmentSnapshot upcoming, CallOutcome outcome, LocalDate today) {
        return step(ActionKind.MOVE_APPOINTMENT, outcome, () -> toAction(ActionKind.MOVE_APPOINTMENT, outcome,
                allocator.bookNearest(today, clock.timeOfDay(), lookaheadDays,
                        slotId -> appointmentService.moveToSlot(upcoming.id(), slotId, outcome))));
    }

    private ReconciliationAction updateToday(Lead lead, AppointmentSnapshot todays, CallOutcome outcome,
                                             double thresholdHours, LocalDate today) {
        if (todays.status() == AppointmentStatus.MISSED && outcome.attended()
                && appointmentService.hasNewerAppointment(lead.getId(), todays.id())) {
            // the missed visit is superseded; attendance belongs to a current appointment
            List<AppointmentSnapshot> upcoming = appointmentService.findUpcoming(lead.getId());
            if (!upcoming.isEmpty()) {
                return move(upcoming.get(0), outcome, today);
            }
            return book(lead, outcome, today);
        }
        return step(ActionKind.UPDATE_APPOINTMENT, outcome, () -> toAction(ActionKind.UPDATE_APPOINTMENT, outcome,
                appointmentService.applyRowOutcome(todays.id(), outcome, thresholdHours)));
    }

    private ReconciliationAction step(ActionKind kind, CallOutcome outcome, Supplier<ReconciliationAction> work) {
        try {
            return work.get();
        } catch (ReconciliationException e) {
            log.warn("Row {} {} failed: {} ({})", outcome.rowNumber(), kind.getValue(), e.getMessage(), e.getKind());
            return ReconciliationAction.failure(kind, outcome.rowNumber(), e.getKind(), e.getMessage());
        } catch (ConcurrencyFailureException e) {
            log.warn("Row {} {} lost a concurrent update", outcome.rowNumber(), kind.getValue(), e);
            return ReconciliationAction.failure(kind, outcome.rowNumber(), ErrorKind.CONCURRENT_UPDATE_CONFLICT,
                    "Concurrent update: " + e.getMostSpecificCause().getMessage());
        } catch (DataAccessException e) {
            rethrowIfStorageDown(e);
            log.error("Row {} {} failed in storage", outcome.rowNumber(), kind.getValue(), e);
            return ReconciliationAction.failure(kind, outcome.rowNumber(), ErrorKind.STORAGE_FAILURE,
                    "Storage error: " + e.getMostSpecificCause().getMessage());
        }
    }

    private ReconciliationAction toAction(ActionKind kind, CallOutcome outcome, AppointmentUpdate update) {
        String message = update.reason();
        if (update.notifyRejection()) {
            message = sendRejection(update, message);
        }
        return ReconciliationAction.builder()
                .action(kind)
                .success(true)
                .message(message)
                .rowNumber(outcome.rowNumber())
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
                .build();
    }

    private String sendRejection(AppointmentUpdate update, String message) {
        boolean borrower = update.partyType() == PartyType.BORROWER;
        NotificationPayload payload = new NotificationPayload(
                update.partyPhone(),
                borrower ? null : update.partyId(),
                borrower ? update.partyId() : null,
                update.partyName(),
                update.appointmentId(),
                "R",
                update.partyType().getValue(),
                clock.now().toString());
        try {
            notificationSink.send(payload);
            return message + "; rejection notified";
        } catch (ReconciliationException e) {
            log.warn("Rejection notification for appointment {} failed: {}", update.appointmentId(), e.getMessage());
            return message + "; notification failed: " + e.getMessage();
        }
    }

    private ReconciliationAction leadCreated(Lead lead, CallOutcome outcome, String message) {
        return ReconciliationAction.builder()
                .action(ActionKind.CREATE_LEAD)
                .success(true)
                .message(message)
                .rowNumber(outcome.rowNumber())
                .partyType(PartyType.LEAD)
                .leadId(lead.getId())
                .leadName(lead.getFullName())
                .newLeadStatus(lead.getStatus())
                .build();
    }

    /**
     * Storage being unreachable aborts the whole batch instead of failing row after row.
     */
    static void rethrowIfStorageDown(RuntimeException e) {
        if (e instanceof DataAccessResourceFailureException || e instanceof CannotCreateTransactionException) {
            throw e;
        }
    }
}
