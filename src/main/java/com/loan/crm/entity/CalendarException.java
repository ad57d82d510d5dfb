package com.loan.crm.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * A dated override of the working calendar, e.g. a public holiday.
 */
@Entity
@Table(name = "calendar_exceptions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarException {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "exception_date", nullable = false)
    private LocalDate exceptionDate;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(columnDefinition = "TEXT")
    private String reason;
}
