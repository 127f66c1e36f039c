package com.lendingengine.credit;

import com.lendingengine.MutableClock;
import com.lendingengine.PoolTestSupport;
import com.lendingengine.TestClockConfig;
import com.lendingengine.common.exception.CollateralLimitExceededException;
import com.lendingengine.common.exception.InsufficientLiquidityException;
import com.lendingengine.common.exception.InvalidAmountException;
import com.lendingengine.common.exception.NoActiveLoanException;
import com.lendingengine.common.exception.OverRepaymentException;
import com.lendingengine.common.exception.TransferFailedException;
import com.lendingengine.events.LendingEvent;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.events.LendingEventType;
import com.lendingengine.pool.LendingPool;
import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LoanState;
import com.lendingengine.store.LedgerStore;
import com.lendingengine.store.PoolState;
import com.lendingengine.supply.SupplyLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for borrowing, repayment and debt queries.
 *
 * The pool runs at an 8000 bps collateral ratio (test profile).
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfig.class, PoolTestSupport.class})
class CreditEngineTest {

    private static final String LENDER = "lender";
    private static final String BORROWER = "borrower";
    private static final String POOL = "lending-pool";
    private static final String TREASURY = "treasury";

    @Autowired
    private LendingPool lendingPool;

    @Autowired
    private SupplyLedger supplyLedger;

    @Autowired
    private CreditEngine creditEngine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private LendingEventService eventService;

    @Autowired
    private PoolTestSupport support;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        support.reset();
        support.fundBase(LENDER, 100_000);
        support.fundCollateral(BORROWER, 100_000);
        lendingPool.deposit(LENDER, 1000);
        lendingPool.depositCollateral(BORROWER, 1000);
    }

    @Test
    void testBorrowUpToCollateralLimit() {
        BorrowerRecord record = lendingPool.borrow(BORROWER, 800);

        assertEquals(800, record.getAmountBorrowed());
        assertEquals(800, record.getInitialBorrowAmount());
        assertEquals(LoanState.ACTIVE, record.getLoanState());
        assertEquals(MutableClock.START, record.getBorrowTimestamp());
        assertEquals(200, supplyLedger.getTotalSupplied());
        assertEquals(800, support.base().balanceOf(BORROWER));

        CollateralLimitExceededException e = assertThrows(CollateralLimitExceededException.class,
            () -> lendingPool.borrow(BORROWER, 1));
        assertTrue(e.getMessage().contains("801"));
        assertEquals(800, lendingPool.getBorrower(BORROWER).orElseThrow().getAmountBorrowed());
    }

    @Test
    void testDebtNeverExceedsLimitAfterBorrow() {
        long limit = 1000 * 8000 / 10_000;
        for (long amount : new long[] {300, 250, 250}) {
            BorrowerRecord record = lendingPool.borrow(BORROWER, amount);
            assertTrue(record.getAmountBorrowed() <= limit);
        }
        assertThrows(CollateralLimitExceededException.class, () -> lendingPool.borrow(BORROWER, 1));
    }

    @Test
    void testBorrowRequiresCollateral() {
        assertThrows(CollateralLimitExceededException.class, () -> lendingPool.borrow("stranger", 10));
    }

    @Test
    void testBorrowLimitedByLiquidity() {
        support.fundCollateral("whale", 10_000);
        lendingPool.depositCollateral("whale", 10_000);

        assertThrows(InsufficientLiquidityException.class, () -> lendingPool.borrow("whale", 1001));

        assertEquals(1000, supplyLedger.getTotalSupplied());
        assertEquals(0, lendingPool.getBorrower("whale").orElseThrow().getAmountBorrowed());
    }

    @Test
    void testZeroAmountsAreRejected() {
        lendingPool.borrow(BORROWER, 100);

        assertThrows(InvalidAmountException.class, () -> lendingPool.borrow(BORROWER, 0));
        assertThrows(InvalidAmountException.class, () -> lendingPool.repay(BORROWER, 0));

        BorrowerRecord record = lendingPool.getBorrower(BORROWER).orElseThrow();
        assertEquals(100, record.getAmountBorrowed());
        assertEquals(0, record.getAmountRepaid());
        assertEquals(900, supplyLedger.getTotalSupplied());
    }

    @Test
    void testFullRepaymentInSecondQuarter() {
        lendingPool.borrow(BORROWER, 800);
        support.base().approve(BORROWER, 864);
        support.base().mint(BORROWER, 64);
        clock.setDay(95);

        assertEquals(864, lendingPool.calculateTotalDebt(BORROWER));
        BorrowerRecord record = lendingPool.repay(BORROWER, 800);

        assertEquals(0, record.getAmountBorrowed());
        assertEquals(800, record.getAmountRepaid());
        assertNull(record.getBorrowTimestamp());
        assertEquals(LoanState.NO_LOAN, record.getLoanState());
        assertEquals(0, support.base().balanceOf(BORROWER));
        // 64 * 150 / 10000 truncates to 0
        assertEquals(0, support.base().balanceOf(TREASURY));
        assertEquals(1000, supplyLedger.getTotalSupplied());
        assertEquals(1064, support.base().balanceOf(POOL));
    }

    @Test
    void testFeeChargedOnlyWhenLoanCloses() {
        support.fundBase("big-lender", 100_000);
        lendingPool.deposit("big-lender", 10_000);
        support.fundCollateral("big-borrower", 10_000);
        lendingPool.depositCollateral("big-borrower", 10_000);
        lendingPool.borrow("big-borrower", 8000);
        support.fundBase("big-borrower", 10_000);
        clock.setDay(300);

        // Q4: interest on 8000 outstanding is 1040 even though only 4000 is repaid
        lendingPool.repay("big-borrower", 4000);
        assertEquals(0, support.base().balanceOf(TREASURY));
        assertEquals(18_000 - 5040, support.base().balanceOf("big-borrower"));

        // Q4 on 4000 outstanding: interest 520, fee 520 * 250 / 10000 = 13
        lendingPool.repay("big-borrower", 4000);
        assertEquals(13, support.base().balanceOf(TREASURY));
        assertEquals(18_000 - 5040 - 4520, support.base().balanceOf("big-borrower"));

        List<LendingEvent> repays = eventService.getEventsOfType(LendingEventType.REPAY);
        assertEquals(2, repays.size());
    }

    @Test
    void testPartialRepayment() {
        lendingPool.borrow(BORROWER, 800);
        support.fundBase(BORROWER, 1000);

        // Q1: 800 * 450 / 10000 = 36
        BorrowerRecord record = lendingPool.repay(BORROWER, 300);

        assertEquals(500, record.getAmountBorrowed());
        assertEquals(300, record.getAmountRepaid());
        assertEquals(800, record.getInitialBorrowAmount());
        assertEquals(MutableClock.START, record.getBorrowTimestamp());
        assertEquals(1800 - 336, support.base().balanceOf(BORROWER));
        assertEquals(500, supplyLedger.getTotalSupplied());
    }

    @Test
    void testRepayWithoutLoan() {
        assertThrows(NoActiveLoanException.class, () -> lendingPool.repay(BORROWER, 10));
        assertThrows(NoActiveLoanException.class, () -> lendingPool.repay("stranger", 10));
    }

    @Test
    void testOverRepayment() {
        lendingPool.borrow(BORROWER, 500);
        support.fundBase(BORROWER, 1000);

        assertThrows(OverRepaymentException.class, () -> lendingPool.repay(BORROWER, 501));
        assertEquals(500, lendingPool.getBorrower(BORROWER).orElseThrow().getAmountBorrowed());
    }

    @Test
    void testFailedPullRollsBackRepayment() {
        lendingPool.borrow(BORROWER, 800);
        support.base().approve(BORROWER, 800);

        // 800 + 36 interest needed, only 800 approved
        assertThrows(TransferFailedException.class, () -> lendingPool.repay(BORROWER, 800));

        BorrowerRecord record = lendingPool.getBorrower(BORROWER).orElseThrow();
        assertEquals(800, record.getAmountBorrowed());
        assertEquals(0, record.getAmountRepaid());
        assertEquals(MutableClock.START, record.getBorrowTimestamp());
        assertEquals(200, supplyLedger.getTotalSupplied());
    }

    @Test
    void testFailedFeePushRefundsBorrower() {
        support.fundBase("big-lender", 100_000);
        lendingPool.deposit("big-lender", 10_000);
        support.fundCollateral("big-borrower", 10_000);
        lendingPool.depositCollateral("big-borrower", 10_000);
        lendingPool.borrow("big-borrower", 8000);
        support.fundBase("big-borrower", 10_000);
        clock.setDay(300);
        long balanceBefore = support.base().balanceOf("big-borrower");
        long custodyBefore = support.base().balanceOf(POOL);
        support.base().freeze(TREASURY);

        assertThrows(TransferFailedException.class, () -> lendingPool.repay("big-borrower", 8000));

        assertEquals(balanceBefore, support.base().balanceOf("big-borrower"));
        assertEquals(custodyBefore, support.base().balanceOf(POOL));
        BorrowerRecord record = lendingPool.getBorrower("big-borrower").orElseThrow();
        assertEquals(8000, record.getAmountBorrowed());
        assertEquals(0, record.getAmountRepaid());
        assertEquals(3000, supplyLedger.getTotalSupplied());
    }

    @Test
    void testDebtAndCollateralRatioQueries() {
        assertEquals(0, lendingPool.calculateTotalDebt(BORROWER));
        assertEquals(CreditEngine.INFINITE_RATIO, lendingPool.getCollateralRatio(BORROWER));
        assertEquals(CreditEngine.INFINITE_RATIO, lendingPool.getCollateralRatio("stranger"));

        lendingPool.borrow(BORROWER, 800);

        assertEquals(12_500, lendingPool.getCollateralRatio(BORROWER));
        assertEquals(836, lendingPool.calculateTotalDebt(BORROWER));
        clock.setDay(200);
        assertEquals(884, lendingPool.calculateTotalDebt(BORROWER));
        clock.setDay(400);
        RepaymentQuote quote = lendingPool.getRepaymentQuote(BORROWER);
        assertEquals(LoanQuarter.Q4, quote.getQuarter());
        assertEquals(104, quote.getInterest());
        assertEquals(2, quote.getFeeOnClosure());
        assertEquals(904, quote.getTotalDebt());
    }

    /**
     * Lifetime repayment baseline: initialBorrowAmount and amountRepaid are never
     * reset when a loan closes, so they accumulate across independent loans.
     */
    @Test
    void testRepaymentBaselinePersistsAcrossLoans() {
        support.fundBase(BORROWER, 1000);
        lendingPool.borrow(BORROWER, 400);
        lendingPool.repay(BORROWER, 400);

        BorrowerRecord record = lendingPool.borrow(BORROWER, 200);

        assertEquals(200, record.getAmountBorrowed());
        assertEquals(600, record.getInitialBorrowAmount());
        assertEquals(400, record.getAmountRepaid());
    }

    @Test
    void testPoolVersionConflictStopsBorrowBeforeFundsMove() {
        assertThrows(OptimisticLockingFailureException.class,
            () -> transactionTemplate.executeWithoutResult(status -> {
                ledgerStore.loadPool();
                bumpPoolVersion();
                creditEngine.borrow(BORROWER, 500, clock.instant());
            }));

        assertEquals(0, support.base().balanceOf(BORROWER));
        assertEquals(1000, support.base().balanceOf(POOL));
        assertEquals(0, lendingPool.getBorrower(BORROWER).orElseThrow().getAmountBorrowed());
        assertEquals(1000, supplyLedger.getTotalSupplied());
    }

    @Test
    void testPoolVersionConflictStopsRepayBeforeFundsMove() {
        lendingPool.borrow(BORROWER, 800);
        support.fundBase(BORROWER, 1000);

        assertThrows(OptimisticLockingFailureException.class,
            () -> transactionTemplate.executeWithoutResult(status -> {
                ledgerStore.loadPool();
                bumpPoolVersion();
                creditEngine.repay(BORROWER, 800, clock.instant());
            }));

        assertEquals(1800, support.base().balanceOf(BORROWER));
        assertEquals(0, support.base().balanceOf(TREASURY));
        assertEquals(800, lendingPool.getBorrower(BORROWER).orElseThrow().getAmountBorrowed());
        assertEquals(200, supplyLedger.getTotalSupplied());
    }

    /**
     * Simulate a concurrent writer committing a newer pool row underneath the
     * current transaction.
     */
    private void bumpPoolVersion() {
        jdbcTemplate.update("update pool_state set version = version + 1 where pool_id = ?", PoolState.POOL_ID);
    }
}
