package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.GenerationResult;
import com.loan.crm.entity.CalendarException;
import com.loan.crm.entity.CalendarSettings;
import com.loan.crm.entity.Timeslot;
import com.loan.crm.repository.CalendarExceptionRepository;
import com.loan.crm.repository.CalendarSettingsRepository;
import com.loan.crm.repository.TimeslotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Slot generation from calendar settings. Existing slots are never duplicated, so re-running is safe.
 */
@Service
public class TimeslotGenerator {

    private static final Logger log = LoggerFactory.getLogger(TimeslotGenerator.class);

    private final CalendarSettingsRepository settingsRepository;
    private final CalendarExceptionRepository exceptionRepository;
    private final TimeslotRepository timeslotRepository;
    private final SingaporeClock clock;
    private final int defaultDaysAhead;

    public TimeslotGenerator(CalendarSettingsRepository settingsRepository,
                             CalendarExceptionRepository exceptionRepository,
                             TimeslotRepository timeslotRepository,
                             SingaporeClock clock,
                             @Value("${crm.seed.timeslots.days-ahead:30}") int defaultDaysAhead) {
        this.settingsRepository = settingsRepository;
        this.exceptionRepository = exceptionRepository;
        this.timeslotRepository = timeslotRepository;
        this.clock = clock;
        this.defaultDaysAhead = defaultDaysAhead;
    }

    /**
     * Generates slots from today (Singapore) for {@code daysAhead} days.
     *
     * @param daysAhead         null for the configured default
     * @param calendarSettingId null for every calendar
     */
    @Transactional
    public GenerationResult generate(Integer daysAhead, Long calendarSettingId) {
        int days = daysAhead != null && daysAhead > 0 ? daysAhead : defaultDaysAhead;
        List<String> errors = new ArrayList<>();

        List<CalendarSettings> settings;
        if (calendarSettingId != null) {
            settings = settingsRepository.findById(calendarSettingId).map(List::of).orElse(List.of());
            if (settings.isEmpty()) {
                errors.add("Calendar setting " + calendarSettingId + " not found");
                return new GenerationResult(false, 0, errors);
            }
        } else {
            settings = settingsRepository.findAllByOrderByIdAsc();
        }

        LocalDate from = clock.today();
        LocalDate to = from.plusDays(days - 1L);
        Set<LocalDate> closed = exceptionRepository.findByExceptionDateBetweenAndClosedTrue(from, to).stream()
                .map(CalendarException::getExceptionDate)
                .collect(Collectors.toSet());
        Set<String> existing = new HashSet<>();
        for (Timeslot t : timeslotRepository.findBySlotDateBetweenOrderBySlotDateAscStartTimeAsc(from, to)) {
            existing.add(key(t.getSlotDate(), t.getStartTime(), t.getEndTime(),
                    t.getCalendarSettings() != null ? t.getCalendarSettings().getId() : null));
        }

        int created = 0;
        for (CalendarSettings cs : settings) {
            if (cs.getDailyStartTime() == null || cs.getDailyEndTime() == null
                    || cs.getSlotDurationMinutes() == null || cs.getSlotDurationMinutes() <= 0) {
                errors.add("Calendar setting " + cs.getId() + " has no working hours or slot duration");
                continue;
            }
            Set<Integer> workingDays = cs.workingDaySet();
            int duration = cs.getSlotDurationMinutes();
            for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
                if (!workingDays.contains(date.getDayOfWeek().getValue()) || closed.contains(date)) {
                    continue;
                }
                for (LocalTime t = cs.getDailyStartTime(); ; t = t.plusMinutes(duration)) {
                    LocalTime end = t.plusMinutes(duration);
                    if (!end.isAfter(t) || end.isAfter(cs.getDailyEndTime())) {
                        break;
                    }
                    if (existing.add(key(date, t, end, cs.getId()))) {
                        timeslotRepository.save(Timeslot.builder()
                                .slotDate(date)
                                .startTime(t)
                                .endTime(end)
                                .maxCapacity(cs.getDefaultMaxCapacity())
                                .calendarSettings(cs)
                                .build());
                        created++;
                    }
                }
            }
        }
        log.info("Generated {} timeslots for {} calendar(s) from {} to {}", created, settings.size(), from, to);
        return new GenerationResult(errors.isEmpty(), created, errors);
    }

    private static String key(LocalDate date, LocalTime start, LocalTime end, Long settingsId) {
        return date + "|" + start + "|" + end + "|" + settingsId;
    }
}
