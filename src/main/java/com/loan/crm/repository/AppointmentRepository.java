package com.loan.crm.repository;

import com.loan.crm.entity.Appointment;
import com.loan.crm.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /**
     * Appointments of a lead starting in [from, to), latest first.
     */
    @Query("SELECT a FROM Appointment a WHERE a.lead.id = :leadId "
            + "AND a.startDatetime >= :from AND a.startDatetime < :to AND a.status <> :excluded "
            + "ORDER BY a.startDatetime DESC, a.id DESC")
    List<Appointment> findForLeadBetween(@Param("leadId") Long leadId,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to,
                                         @Param("excluded") AppointmentStatus excluded);

    List<Appointment> findByLeadIdAndStatusOrderByStartDatetimeAsc(Long leadId, AppointmentStatus status);

    boolean existsByLeadIdAndStatus(Long leadId, AppointmentStatus status);

    long countByLeadIdAndStatus(Long leadId, AppointmentStatus status);

    /**
     * True when the lead has an appointment created after the given one that is not in the excluded status.
     */
    @Query("SELECT COUNT(a) > 0 FROM Appointment a WHERE a.lead.id = :leadId "
            + "AND a.id > :appointmentId AND a.status <> :excluded")
    boolean existsNewerThan(@Param("leadId") Long leadId,
                            @Param("appointmentId") Long appointmentId,
                            @Param("excluded") AppointmentStatus excluded);

    @Query("SELECT a.id FROM Appointment a WHERE a.status = :status "
            + "AND a.startDatetime >= :from AND a.startDatetime < :to ORDER BY a.startDatetime ASC, a.id ASC")
    List<Long> findIdsByStatusStartingBetween(@Param("status") AppointmentStatus status,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}
