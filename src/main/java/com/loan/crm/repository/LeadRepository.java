package com.loan.crm.repository;

import com.loan.crm.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    /**
     * Leads whose primary or alternate phone normalizes to {@code key}, oldest first.
     * Soft-deleted leads are never returned.
     */
    @Query("SELECT l FROM Lead l WHERE l.deleted = false AND "
            + "(l.phoneKey = :key OR l.phoneKey2 = :key OR l.phoneKey3 = :key) "
            + "ORDER BY l.id ASC")
    List<Lead> findByAnyPhoneKey(@Param("key") String key);

    /** Rows written before the key columns were populated. */
    @Query("SELECT l FROM Lead l WHERE l.phoneKey IS NULL AND l.phoneNumber IS NOT NULL")
    List<Lead> findWithoutPhoneKey();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Lead l WHERE l.id = :id")
    Optional<Lead> findByIdForUpdate(@Param("id") Long id);
}
