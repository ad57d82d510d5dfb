package com.loan.crm.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A bookable unit of capacity. Dates and times are Singapore local.
 * {@code occupiedCount} is only changed through the conditional updates in
 * {@code TimeslotRepository}, never by loading and saving the entity.
 */
@Entity
@Table(name = "timeslots", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"slot_date", "start_time", "end_time", "calendar_setting_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Timeslot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "max_capacity", nullable = false)
    @Builder.Default
    private int maxCapacity = 1;

    @Column(name = "occupied_count", nullable = false)
    @Builder.Default
    private int occupiedCount = 0;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "calendar_setting_id")
    private CalendarSettings calendarSettings;

    @Column(name = "is_disabled", nullable = false)
    private boolean disabled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasCapacity() {
        return !disabled && occupiedCount < maxCapacity;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }
}
