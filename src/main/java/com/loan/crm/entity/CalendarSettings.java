package com.loan.crm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "calendar_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    /**
     * Comma separated ISO days of week: 1 = Monday, 7 = Sunday (java.time.DayOfWeek)
     */
    @Column(name = "working_days", length = 20)
    @Builder.Default
    private String workingDays = "1,2,3,4,5";

    @Column(name = "daily_start_time")
    private LocalTime dailyStartTime;

    @Column(name = "daily_end_time")
    private LocalTime dailyEndTime;

    @Column(name = "slot_duration_minutes")
    @Builder.Default
    private Integer slotDurationMinutes = 30;

    @Column(name = "default_max_capacity", nullable = false)
    @Builder.Default
    private int defaultMaxCapacity = 1;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Set<Integer> workingDaySet() {
        if (StringUtils.isBlank(workingDays)) {
            return Set.of(1, 2, 3, 4, 5);
        }
        return Arrays.stream(workingDays.split(","))
                .map(String::trim)
                .filter(StringUtils::isNumeric)
                .map(Integer::valueOf)
                .collect(Collectors.toSet());
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
