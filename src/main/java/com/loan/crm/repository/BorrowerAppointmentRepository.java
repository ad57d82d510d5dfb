package com.loan.crm.repository;

import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.BorrowerAppointment;
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
public interface BorrowerAppointmentRepository extends JpaRepository<BorrowerAppointment, Long> {

    @Query("SELECT a FROM BorrowerAppointment a WHERE a.borrower.id = :borrowerId "
            + "AND a.startDatetime >= :from AND a.startDatetime < :to AND a.status <> :excluded "
            + "ORDER BY a.startDatetime DESC, a.id DESC")
    List<BorrowerAppointment> findForBorrowerBetween(@Param("borrowerId") Long borrowerId,
                                                     @Param("from") Instant from,
                                                     @Param("to") Instant to,
                                                     @Param("excluded") AppointmentStatus excluded);

    @Query("SELECT a.id FROM BorrowerAppointment a WHERE a.status = :status "
            + "AND a.startDatetime >= :from AND a.startDatetime < :to ORDER BY a.startDatetime ASC, a.id ASC")
    List<Long> findIdsByStatusStartingBetween(@Param("status") AppointmentStatus status,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM BorrowerAppointment a WHERE a.id = :id")
    Optional<BorrowerAppointment> findByIdForUpdate(@Param("id") Long id);
}
