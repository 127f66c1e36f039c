package com.lendingengine.collateral;

import com.lendingengine.assets.PoolAssets;
import com.lendingengine.assets.TransferBatch;
import com.lendingengine.common.Amounts;
import com.lendingengine.common.BasisPoints;
import com.lendingengine.common.exception.CollateralLimitExceededException;
import com.lendingengine.common.exception.InsufficientBalanceException;
import com.lendingengine.config.PoolConfiguration;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Collateral bookkeeping for borrowers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollateralVault {

    private final LedgerStore ledgerStore;
    private final PoolAssets poolAssets;
    private final PoolConfiguration configuration;
    private final LendingEventService eventService;

    /**
     * Lock collateral for a borrower, creating the borrower record on first use.
     *
     * Stamps {@code borrowTimestamp} with the deposit time even when no loan exists
     * yet, and even when a loan is already running. The next borrow overwrites it.
     */
    @Transactional
    public BorrowerRecord depositCollateral(String borrower, long amount, Instant now) {
        Amounts.requirePositive(amount, "depositCollateral");

        BorrowerRecord record = ledgerStore.getOrCreateBorrower(borrower);
        record.setCollateralDeposited(Math.addExact(record.getCollateralDeposited(), amount));
        record.setBorrowTimestamp(now);
        record.setLastIteration(now);
        ledgerStore.saveBorrower(record);
        eventService.recordCollateralDeposit(borrower, amount, now);
        ledgerStore.flush();

        TransferBatch.create()
            .pull(poolAssets.collateral(), borrower, amount)
            .execute();

        log.info("Borrower {} deposited collateral {}; collateral={}",
            borrower, amount, record.getCollateralDeposited());
        return record;
    }

    /**
     * Release collateral that no longer backs outstanding principal.
     */
    @Transactional
    public BorrowerRecord withdrawCollateral(String borrower, long amount, Instant now) {
        Amounts.requirePositive(amount, "withdrawCollateral");

        BorrowerRecord record = ledgerStore.findBorrower(borrower)
            .orElseThrow(() -> new InsufficientBalanceException(borrower, amount, 0));
        if (amount > record.getCollateralDeposited()) {
            throw new InsufficientBalanceException(borrower, amount, record.getCollateralDeposited());
        }

        long remaining = record.getCollateralDeposited() - amount;
        long capacity = BasisPoints.apply(remaining, configuration.getCollateralRatioBps());
        if (record.getAmountBorrowed() > capacity) {
            throw new CollateralLimitExceededException(borrower, record.getAmountBorrowed(), capacity);
        }

        record.setCollateralDeposited(remaining);
        record.setLastIteration(now);
        ledgerStore.saveBorrower(record);
        eventService.recordCollateralWithdraw(borrower, amount, now);
        ledgerStore.flush();

        TransferBatch.create()
            .push(poolAssets.collateral(), borrower, amount)
            .execute();

        log.info("Borrower {} withdrew collateral {}; collateral={}", borrower, amount, remaining);
        return record;
    }

    @Transactional(readOnly = true)
    public long getCollateral(String borrower) {
        return ledgerStore.findBorrower(borrower)
            .map(BorrowerRecord::getCollateralDeposited)
            .orElse(0L);
    }
}
