package com.loan.crm.service;

import com.loan.crm.entity.CalendarSettings;
import com.loan.crm.repository.CalendarExceptionRepository;
import com.loan.crm.repository.CalendarSettingsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
public class WorkingCalendar {

    private static final int MAX_SEARCH_DAYS = 60;

    private final CalendarSettingsRepository settingsRepository;
    private final CalendarExceptionRepository exceptionRepository;

    public WorkingCalendar(CalendarSettingsRepository settingsRepository,
                           CalendarExceptionRepository exceptionRepository) {
        this.settingsRepository = settingsRepository;
        this.exceptionRepository = exceptionRepository;
    }

    /**
     * A working day of any calendar that is not closed by an exception. Without settings, Monday to Friday.
     */
    @Transactional(readOnly = true)
    public boolean isWorkingDay(LocalDate date) {
        if (exceptionRepository.existsByExceptionDateAndClosedTrue(date)) {
            return false;
        }
        int dayOfWeek = date.getDayOfWeek().getValue();
        List<CalendarSettings> settings = settingsRepository.findAll();
        if (settings.isEmpty()) {
            return dayOfWeek <= 5;
        }
        return settings.stream().anyMatch(s -> s.workingDaySet().contains(dayOfWeek));
    }

    @Transactional(readOnly = true)
    public Optional<LocalDate> nextWorkingDay(LocalDate date) {
        LocalDate candidate = date.plusDays(1);
        for (int i = 0; i < MAX_SEARCH_DAYS; i++, candidate = candidate.plusDays(1)) {
            if (isWorkingDay(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
