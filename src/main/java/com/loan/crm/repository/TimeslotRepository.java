package com.loan.crm.repository;

import com.loan.crm.entity.Timeslot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Repository
public interface TimeslotRepository extends JpaRepository<Timeslot, Long> {

    List<Timeslot> findBySlotDateAndDisabledFalseOrderByStartTimeAsc(LocalDate slotDate);

    List<Timeslot> findBySlotDateBetweenOrderBySlotDateAscStartTimeAsc(LocalDate from, LocalDate to);

    /**
     * Takes one unit of capacity. Returns 1 when taken, 0 when the slot is full, disabled or missing.
     */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Timeslot t SET t.occupiedCount = t.occupiedCount + 1, t.updatedAt = :now "
            + "WHERE t.id = :id AND t.occupiedCount < t.maxCapacity AND t.disabled = false")
    int incrementIfAvailable(@Param("id") Long id, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Timeslot t SET t.occupiedCount = t.occupiedCount - 1, t.updatedAt = :now "
            + "WHERE t.id = :id AND t.occupiedCount > 0")
    int decrementIfOccupied(@Param("id") Long id, @Param("now") Instant now);

    @Query("SELECT t.occupiedCount FROM Timeslot t WHERE t.id = :id")
    Integer findOccupiedCount(@Param("id") Long id);
}
