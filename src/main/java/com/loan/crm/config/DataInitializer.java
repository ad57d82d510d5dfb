package com.loan.crm.config;

import com.loan.crm.dto.GenerationResult;
import com.loan.crm.entity.CalendarSettings;
import com.loan.crm.repository.CalendarSettingsRepository;
import com.loan.crm.service.PhoneMatcher;
import com.loan.crm.service.TimeslotGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

/**
 * Idempotent seeder: inserts a default calendar if none exists, tops up the slot horizon and fills
 * missing phone keys. Safe to re-run.
 */
@Component
@ConditionalOnProperty(prefix = "crm.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final CalendarSettingsRepository settingsRepository;
    private final TimeslotGenerator timeslotGenerator;
    private final PhoneMatcher phoneMatcher;

    @Value("${crm.seed.calendar.name:Default}")
    private String calendarName;

    @Value("${crm.seed.calendar.working-days:1,2,3,4,5}")
    private String workingDays;

    @Value("${crm.seed.calendar.daily-start:10:00}")
    private String dailyStart;

    @Value("${crm.seed.calendar.daily-end:18:00}")
    private String dailyEnd;

    @Value("${crm.seed.calendar.slot-duration-minutes:30}")
    private int slotDurationMinutes;

    @Value("${crm.seed.calendar.default-max-capacity:1}")
    private int defaultMaxCapacity;

    public DataInitializer(CalendarSettingsRepository settingsRepository,
                           TimeslotGenerator timeslotGenerator,
                           PhoneMatcher phoneMatcher) {
        this.settingsRepository = settingsRepository;
        this.timeslotGenerator = timeslotGenerator;
        this.phoneMatcher = phoneMatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        if (settingsRepository.count() == 0) {
            log.info("Seeding calendar settings...");
            settingsRepository.save(CalendarSettings.builder()
                    .name(calendarName)
                    .workingDays(workingDays)
                    .dailyStartTime(LocalTime.parse(dailyStart))
                    .dailyEndTime(LocalTime.parse(dailyEnd))
                    .slotDurationMinutes(slotDurationMinutes)
                    .defaultMaxCapacity(defaultMaxCapacity)
                    .build());
        }
        GenerationResult result = timeslotGenerator.generate(null, null);
        if (!result.errors().isEmpty()) {
            log.warn("Timeslot generation reported errors: {}", result.errors());
        }
        int keyed = phoneMatcher.backfillPhoneKeys();
        log.info("DataInitializer: calendars={}, new timeslots={}, phone keys filled={}",
                settingsRepository.count(), result.created(), keyed);
    }
}
