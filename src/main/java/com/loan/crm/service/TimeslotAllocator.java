package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.entity.Timeslot;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import com.loan.crm.repository.TimeslotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Capacity bookkeeping for timeslots. The counter is only ever moved by a single conditional
 * UPDATE, so concurrent bookings can never push it past max capacity or below zero.
 */
@Service
public class TimeslotAllocator {

    private static final Logger log = LoggerFactory.getLogger(TimeslotAllocator.class);
    static final int MAX_ATTEMPTS_PER_DAY = 5;

    private final TimeslotRepository timeslotRepository;
    private final WorkingCalendar workingCalendar;
    private final SingaporeClock clock;

    public TimeslotAllocator(TimeslotRepository timeslotRepository,
                             WorkingCalendar workingCalendar,
                             SingaporeClock clock) {
        this.timeslotRepository = timeslotRepository;
        this.workingCalendar = workingCalendar;
        this.clock = clock;
    }

    /**
     * First enabled slot on {@code date} with spare capacity, starting at or after {@code fromTime} when given.
     */
    public Optional<Timeslot> findNearest(LocalDate date, LocalTime fromTime) {
        return timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(date).stream()
                .filter(s -> fromTime == null || !s.getStartTime().isBefore(fromTime))
                .filter(Timeslot::hasCapacity)
                .findFirst();
    }

    public void allocate(Long slotId) {
        int updated = timeslotRepository.incrementIfAvailable(slotId, clock.now());
        if (updated == 0) {
            throw ReconciliationException.slotFull(slotId);
        }
        log.debug("Allocated slot {}", slotId);
    }

    public void release(Long slotId) {
        int updated = timeslotRepository.decrementIfOccupied(slotId, clock.now());
        if (updated == 0) {
            log.warn("Release of slot {} ignored: nothing occupied", slotId);
        }
    }

    public Optional<LocalDate> nextWorkingDay(LocalDate date) {
        return workingCalendar.nextWorkingDay(date);
    }

    /**
     * Books into the nearest free slot: today from now, then today from the start of the day,
     * then up to {@code lookaheadDays} further working days. {@code booker} must allocate the slot
     * in its own transaction and throw SLOT_FULL when it lost the race.
     */
    public <T> T bookNearest(LocalDate today, LocalTime now, int lookaheadDays, Function<Long, T> booker) {
        List<LocalDate> days = new ArrayList<>();
        List<LocalTime> fromTimes = new ArrayList<>();
        days.add(today);
        fromTimes.add(now);
        days.add(today);
        fromTimes.add(null);
        LocalDate day = today;
        for (int i = 0; i < lookaheadDays; i++) {
            Optional<LocalDate> next = nextWorkingDay(day);
            if (next.isEmpty()) {
                break;
            }
            day = next.get();
            days.add(day);
            fromTimes.add(null);
        }

        boolean conflictRetried = false;
        for (int i = 0; i < days.size(); i++) {
            for (int attempt = 0; attempt < MAX_ATTEMPTS_PER_DAY; attempt++) {
                Optional<Timeslot> slot = findNearest(days.get(i), fromTimes.get(i));
                if (slot.isEmpty()) {
                    break;
                }
                try {
                    return booker.apply(slot.get().getId());
                } catch (ReconciliationException e) {
                    if (e.getKind() != ErrorKind.SLOT_FULL) {
                        throw e;
                    }
                    log.debug("Slot {} taken concurrently, searching again", slot.get().getId());
                } catch (ConcurrencyFailureException e) {
                    if (conflictRetried) {
                        throw new ReconciliationException(ErrorKind.SLOT_FULL,
                                "Concurrent update on slot " + slot.get().getId(), e);
                    }
                    conflictRetried = true;
                    log.warn("Concurrent update while booking slot {}, retrying once", slot.get().getId());
                }
            }
        }
        throw new ReconciliationException(ErrorKind.NO_SLOT_AVAILABLE,
                "No timeslot available from " + today + (lookaheadDays > 0 ? " (+" + lookaheadDays + " working days)" : ""));
    }
}
