package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.entity.Timeslot;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import com.loan.crm.repository.TimeslotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeslotAllocatorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 21);

    @Mock
    private TimeslotRepository timeslotRepository;

    @Mock
    private WorkingCalendar workingCalendar;

    private TimeslotAllocator allocator;

    @BeforeEach
    void setUp() {
        SingaporeClock clock = new SingaporeClock(Clock.fixed(Instant.parse("2025-03-21T04:00:00Z"), ZoneOffset.UTC));
        allocator = new TimeslotAllocator(timeslotRepository, workingCalendar, clock);
    }

    private static Timeslot slot(long id, LocalDate date, String start, int capacity, int occupied) {
        LocalTime t = LocalTime.parse(start);
        return Timeslot.builder().id(id).slotDate(date).startTime(t).endTime(t.plusMinutes(30))
                .maxCapacity(capacity).occupiedCount(occupied).build();
    }

    @Test
    @DisplayName("Nearest slot skips earlier and full slots")
    void findNearestSkipsEarlierAndFull() {
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY)).thenReturn(List.of(
                slot(1, TODAY, "10:00", 1, 0),
                slot(2, TODAY, "12:00", 1, 1),
                slot(3, TODAY, "12:30", 2, 1)));

        assertThat(allocator.findNearest(TODAY, LocalTime.of(11, 45))).map(Timeslot::getId).contains(3L);
        assertThat(allocator.findNearest(TODAY, null)).map(Timeslot::getId).contains(1L);
    }

    @Test
    void allocateFailsWhenNoRowUpdated() {
        when(timeslotRepository.incrementIfAvailable(eq(5L), any())).thenReturn(0);

        ReconciliationException e = catchThrowableOfType(() -> allocator.allocate(5L), ReconciliationException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.SLOT_FULL);
    }

    @Test
    void bookNearestFallsBackToEarlierSlotsToday() {
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY))
                .thenReturn(List.of(slot(1, TODAY, "10:00", 1, 0)));

        Long booked = allocator.bookNearest(TODAY, LocalTime.of(12, 0), 0, slotId -> slotId);

        assertThat(booked).isEqualTo(1L);
    }

    @Test
    void bookNearestRetriesWhenSlotTakenConcurrently() {
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY))
                .thenReturn(List.of(slot(1, TODAY, "12:00", 1, 0), slot(2, TODAY, "12:30", 1, 0)))
                .thenReturn(List.of(slot(1, TODAY, "12:00", 1, 1), slot(2, TODAY, "12:30", 1, 0)));
        List<Long> attempts = new ArrayList<>();

        Long booked = allocator.bookNearest(TODAY, LocalTime.of(12, 0), 0, slotId -> {
            attempts.add(slotId);
            if (slotId == 1L) {
                throw ReconciliationException.slotFull(slotId);
            }
            return slotId;
        });

        assertThat(booked).isEqualTo(2L);
        assertThat(attempts).containsExactly(1L, 2L);
    }

    @Test
    void secondConcurrencyFailureSurfacesAsSlotFull() {
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY))
                .thenReturn(List.of(slot(1, TODAY, "12:00", 1, 0)));

        ReconciliationException e = catchThrowableOfType(() -> allocator.bookNearest(TODAY, LocalTime.NOON, 0,
                slotId -> {
                    throw new PessimisticLockingFailureException("lock wait timeout");
                }), ReconciliationException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.SLOT_FULL);
    }

    @Test
    void noSlotAnywhereIsNoSlotAvailable() {
        LocalDate monday = LocalDate.of(2025, 3, 24);
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY))
                .thenReturn(List.of(slot(1, TODAY, "10:00", 1, 1)));
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(monday)).thenReturn(List.of());
        when(workingCalendar.nextWorkingDay(TODAY)).thenReturn(Optional.of(monday));

        assertThatThrownBy(() -> allocator.bookNearest(TODAY, LocalTime.NOON, 1, slotId -> slotId))
                .isInstanceOf(ReconciliationException.class)
                .hasMessageContaining("No timeslot available");
    }

    @Test
    void lookaheadBooksNextWorkingDay() {
        LocalDate monday = LocalDate.of(2025, 3, 24);
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(TODAY)).thenReturn(List.of());
        when(timeslotRepository.findBySlotDateAndDisabledFalseOrderByStartTimeAsc(monday))
                .thenReturn(List.of(slot(9, monday, "10:00", 1, 0)));
        when(workingCalendar.nextWorkingDay(TODAY)).thenReturn(Optional.of(monday));

        Long booked = allocator.bookNearest(TODAY, LocalTime.NOON, 1, slotId -> slotId);

        assertThat(booked).isEqualTo(9L);
    }
}
