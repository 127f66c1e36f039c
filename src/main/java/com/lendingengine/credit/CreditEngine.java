package com.lendingengine.credit;

import com.lendingengine.assets.PoolAssets;
import com.lendingengine.assets.TransferBatch;
import com.lendingengine.common.Amounts;
import com.lendingengine.common.BasisPoints;
import com.lendingengine.common.exception.CollateralLimitExceededException;
import com.lendingengine.common.exception.InsufficientLiquidityException;
import com.lendingengine.common.exception.NoActiveLoanException;
import com.lendingengine.common.exception.OverRepaymentException;
import com.lendingengine.config.PoolConfiguration;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LedgerStore;
import com.lendingengine.store.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Borrow and repay state transitions plus the debt views liquidation relies on.
 *
 * Borrow flow:
 * 1. Check the collateral-backed limit and pool liquidity
 * 2. Increase principal, stamp the loan start, take liquidity out of the pool
 * 3. Push the borrowed base asset to the borrower
 *
 * Repay flow:
 * 1. Price interest for the loan's current quarter on the full outstanding principal
 * 2. Reduce principal, return it to pool liquidity
 * 3. Pull principal plus interest; on full closure push the fee to the fee recipient
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditEngine {

    /**
     * Collateral ratio reported for a borrower with no debt.
     */
    public static final long INFINITE_RATIO = Long.MAX_VALUE;

    private final LedgerStore ledgerStore;
    private final PoolAssets poolAssets;
    private final PoolConfiguration configuration;
    private final InterestRateSchedule schedule;
    private final LendingEventService eventService;

    @Transactional
    public BorrowerRecord borrow(String borrower, long amount, Instant now) {
        Amounts.requirePositive(amount, "borrow");

        BorrowerRecord record = ledgerStore.findBorrower(borrower)
            .orElseThrow(() -> new CollateralLimitExceededException(borrower, amount, 0));
        long maxBorrowable = maxBorrowable(record);
        long newDebt = Math.addExact(record.getAmountBorrowed(), amount);
        if (record.getCollateralDeposited() == 0 || newDebt > maxBorrowable) {
            throw new CollateralLimitExceededException(borrower, newDebt, maxBorrowable);
        }

        PoolState pool = ledgerStore.loadPool();
        if (amount > pool.getTotalSupplied()) {
            throw new InsufficientLiquidityException(amount, pool.getTotalSupplied());
        }

        record.setAmountBorrowed(newDebt);
        record.setInitialBorrowAmount(Math.addExact(record.getInitialBorrowAmount(), amount));
        record.setBorrowTimestamp(now);
        record.setLastIteration(now);
        pool.setTotalSupplied(pool.getTotalSupplied() - amount);
        pool.setUpdatedAt(now);
        ledgerStore.saveBorrower(record);
        ledgerStore.savePool(pool);
        eventService.recordBorrow(borrower, amount, now);
        ledgerStore.flush();

        TransferBatch.create()
            .push(poolAssets.base(), borrower, amount)
            .execute();

        log.info("Borrower {} borrowed {}; outstanding={}, limit={}, totalSupplied={}",
            borrower, amount, newDebt, maxBorrowable, pool.getTotalSupplied());
        return record;
    }

    /**
     * Repay part or all of the outstanding principal.
     *
     * Interest is charged on the whole outstanding principal at the current
     * quarter's rate, regardless of how much principal is repaid. The fee is only
     * taken when the repayment closes the loan.
     */
    @Transactional
    public BorrowerRecord repay(String borrower, long principal, Instant now) {
        Amounts.requirePositive(principal, "repay");

        BorrowerRecord record = ledgerStore.findBorrower(borrower)
            .filter(BorrowerRecord::hasActiveLoan)
            .orElseThrow(() -> new NoActiveLoanException(borrower));
        if (principal > record.getAmountBorrowed()) {
            throw new OverRepaymentException(borrower, principal, record.getAmountBorrowed());
        }

        LoanQuarter quarter = schedule.quarterFor(record.getBorrowTimestamp(), now);
        long interest = schedule.interest(record.getAmountBorrowed(), quarter);
        long amountDue = Math.addExact(principal, interest);

        record.setAmountBorrowed(record.getAmountBorrowed() - principal);
        record.setAmountRepaid(Math.addExact(record.getAmountRepaid(), principal));
        record.setLastIteration(now);

        PoolState pool = ledgerStore.loadPool();
        pool.setTotalSupplied(Math.addExact(pool.getTotalSupplied(), principal));
        pool.setUpdatedAt(now);

        boolean closed = !record.hasActiveLoan();
        long fee = 0;
        if (closed) {
            record.setBorrowTimestamp(null);
            fee = schedule.fee(interest, quarter);
        }
        ledgerStore.saveBorrower(record);
        ledgerStore.savePool(pool);
        eventService.recordRepay(borrower, principal, interest, now);
        ledgerStore.flush();

        TransferBatch transfers = TransferBatch.create()
            .pull(poolAssets.base(), borrower, amountDue);
        if (closed) {
            transfers.push(poolAssets.base(), pool.getFeeRecipient(), fee);
        }
        transfers.execute();

        log.info("Borrower {} repaid {} + {} interest ({}); outstanding={}, closed={}, fee={}",
            borrower, principal, interest, quarter, record.getAmountBorrowed(), closed, fee);
        return record;
    }

    /**
     * Outstanding principal plus interest at the current quarter's rate; 0 without a loan.
     */
    @Transactional(readOnly = true)
    public long calculateTotalDebt(String borrower, Instant now) {
        return getRepaymentQuote(borrower, now).getTotalDebt();
    }

    @Transactional(readOnly = true)
    public RepaymentQuote getRepaymentQuote(String borrower, Instant now) {
        Optional<BorrowerRecord> active = ledgerStore.findBorrower(borrower)
            .filter(BorrowerRecord::hasActiveLoan);
        if (active.isEmpty()) {
            return RepaymentQuote.none(borrower);
        }

        BorrowerRecord record = active.get();
        LoanQuarter quarter = schedule.quarterFor(record.getBorrowTimestamp(), now);
        long interest = schedule.interest(record.getAmountBorrowed(), quarter);
        return RepaymentQuote.builder()
            .borrower(borrower)
            .quarter(quarter)
            .principal(record.getAmountBorrowed())
            .interest(interest)
            .feeOnClosure(schedule.fee(interest, quarter))
            .totalDebt(Math.addExact(record.getAmountBorrowed(), interest))
            .build();
    }

    /**
     * Collateral as basis points of outstanding principal, {@link #INFINITE_RATIO} without a loan.
     */
    @Transactional(readOnly = true)
    public long getCollateralRatio(String borrower) {
        return ledgerStore.findBorrower(borrower)
            .map(this::collateralRatio)
            .orElse(INFINITE_RATIO);
    }

    @Transactional(readOnly = true)
    public Optional<BorrowerRecord> getBorrower(String borrower) {
        return ledgerStore.findBorrower(borrower);
    }

    public long collateralRatio(BorrowerRecord record) {
        if (!record.hasActiveLoan()) {
            return INFINITE_RATIO;
        }
        return BasisPoints.ratio(record.getCollateralDeposited(), record.getAmountBorrowed());
    }

    public long maxBorrowable(BorrowerRecord record) {
        return BasisPoints.apply(record.getCollateralDeposited(), configuration.getCollateralRatioBps());
    }
}
