package com.loan.crm.repository;

import com.loan.crm.entity.CalendarException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface CalendarExceptionRepository extends JpaRepository<CalendarException, Long> {

    boolean existsByExceptionDateAndClosedTrue(LocalDate exceptionDate);

    List<CalendarException> findByExceptionDateBetweenAndClosedTrue(LocalDate from, LocalDate to);
}
