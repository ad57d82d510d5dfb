package com.loan.crm.component;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * All business dates are Singapore local; everything persisted is a UTC instant.
 */
@Component
public class SingaporeClock {

    public static final ZoneId ZONE = ZoneId.of("Asia/Singapore");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final Clock clock;

    public SingaporeClock(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public LocalDate today() {
        return LocalDate.ofInstant(now(), ZONE);
    }

    public LocalTime timeOfDay() {
        return LocalTime.ofInstant(now(), ZONE);
    }

    public ZonedDateTime toSingapore(Instant instant) {
        return instant.atZone(ZONE);
    }

    public Instant toUtc(LocalDate date, LocalTime time) {
        return LocalDateTime.of(date, time).atZone(ZONE).toInstant();
    }

    public Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZONE).toInstant();
    }

    public Instant startOfNextDay(LocalDate date) {
        return startOfDay(date.plusDays(1));
    }

    /** Fractional hours elapsed since {@code start}; negative when it lies in the future. */
    public double hoursSince(Instant start) {
        return Duration.between(start, now()).toMillis() / 3_600_000d;
    }

    public String format(Instant instant) {
        return instant == null ? null : DISPLAY.format(toSingapore(instant));
    }
}
