package com.lendingengine.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for borrower credit positions.
 */
@Repository
public interface BorrowerRecordRepository extends JpaRepository<BorrowerRecord, String> {

    List<BorrowerRecord> findByAmountBorrowedGreaterThanOrderByAccountAsc(long amount);
}
