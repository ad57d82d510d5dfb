package com.loan.crm.repository;

import com.loan.crm.entity.Borrower;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BorrowerRepository extends JpaRepository<Borrower, Long> {

    @Query("SELECT b FROM Borrower b WHERE b.deleted = false AND "
            + "(b.phoneKey = :key OR b.phoneKey2 = :key OR b.phoneKey3 = :key) "
            + "ORDER BY b.id ASC")
    List<Borrower> findByAnyPhoneKey(@Param("key") String key);

    @Query("SELECT b FROM Borrower b WHERE b.phoneKey IS NULL AND b.phoneNumber IS NOT NULL")
    List<Borrower> findWithoutPhoneKey();
}
