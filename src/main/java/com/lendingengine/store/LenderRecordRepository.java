package com.lendingengine.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repository for lender supply positions.
 */
@Repository
public interface LenderRecordRepository extends JpaRepository<LenderRecord, String> {

    @Query("select coalesce(sum(l.amountSupplied), 0L) from LenderRecord l")
    long sumAmountSupplied();
}
