package com.loan.crm.repository;

import com.loan.crm.entity.CalendarSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CalendarSettingsRepository extends JpaRepository<CalendarSettings, Long> {

    List<CalendarSettings> findAllByOrderByIdAsc();
}
