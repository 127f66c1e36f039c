package com.lendingengine.pool;

import com.lendingengine.collateral.CollateralVault;
import com.lendingengine.common.Amounts;
import com.lendingengine.credit.CreditEngine;
import com.lendingengine.credit.RepaymentQuote;
import com.lendingengine.liquidation.LiquidationEngine;
import com.lendingengine.liquidation.LiquidationReason;
import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LenderRecord;
import com.lendingengine.store.PoolState;
import com.lendingengine.supply.SupplyLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every pool operation.
 *
 * Mutations run one at a time under the {@link ExecutionGuard}; each reads the
 * clock exactly once and hands that instant to the engine, so quarter and
 * eligibility decisions inside one call agree with each other. Reads are
 * side-effect free and do not take the guard.
 */
@Service
@RequiredArgsConstructor
public class LendingPool {

    private final ExecutionGuard guard;
    private final Clock clock;
    private final SupplyLedger supplyLedger;
    private final CollateralVault collateralVault;
    private final CreditEngine creditEngine;
    private final LiquidationEngine liquidationEngine;
    private final PoolAdminService adminService;

    public LenderRecord deposit(String lender, long amount) {
        Amounts.requireAccount(lender);
        return guard.execute("deposit", () -> supplyLedger.deposit(lender, amount, now()));
    }

    public LenderRecord withdraw(String lender, long amount) {
        Amounts.requireAccount(lender);
        return guard.execute("withdraw", () -> supplyLedger.withdraw(lender, amount, now()));
    }

    public BorrowerRecord depositCollateral(String borrower, long amount) {
        Amounts.requireAccount(borrower);
        return guard.execute("depositCollateral", () -> collateralVault.depositCollateral(borrower, amount, now()));
    }

    public BorrowerRecord withdrawCollateral(String borrower, long amount) {
        Amounts.requireAccount(borrower);
        return guard.execute("withdrawCollateral", () -> collateralVault.withdrawCollateral(borrower, amount, now()));
    }

    public BorrowerRecord borrow(String borrower, long amount) {
        Amounts.requireAccount(borrower);
        return guard.execute("borrow", () -> creditEngine.borrow(borrower, amount, now()));
    }

    public BorrowerRecord repay(String borrower, long principal) {
        Amounts.requireAccount(borrower);
        return guard.execute("repay", () -> creditEngine.repay(borrower, principal, now()));
    }

    public BorrowerRecord liquidate(String liquidator, String borrower) {
        Amounts.requireAccount(liquidator);
        Amounts.requireAccount(borrower);
        return guard.execute("liquidate", () -> liquidationEngine.liquidate(liquidator, borrower, now()));
    }

    public PoolState updateFeeRecipient(String caller, String newRecipient) {
        Amounts.requireAccount(caller);
        return guard.execute("updateFeeRecipient", () -> adminService.updateFeeRecipient(caller, newRecipient, now()));
    }

    public long getLenderBalance(String lender) {
        return supplyLedger.getLenderBalance(lender);
    }

    public Optional<BorrowerRecord> getBorrower(String borrower) {
        return creditEngine.getBorrower(borrower);
    }

    public long calculateTotalDebt(String borrower) {
        return creditEngine.calculateTotalDebt(borrower, now());
    }

    public RepaymentQuote getRepaymentQuote(String borrower) {
        return creditEngine.getRepaymentQuote(borrower, now());
    }

    public long getCollateralRatio(String borrower) {
        return creditEngine.getCollateralRatio(borrower);
    }

    public boolean isLiquidatable(String borrower) {
        return liquidationEngine.isLiquidatable(borrower, now());
    }

    public List<LiquidationReason> getLiquidationReasons(String borrower) {
        return liquidationEngine.getLiquidationReasons(borrower, now());
    }

    public Map<String, List<LiquidationReason>> findLiquidatablePositions() {
        return liquidationEngine.findLiquidatable(now());
    }

    public PoolOverview getOverview() {
        return adminService.getOverview();
    }

    private Instant now() {
        return clock.instant();
    }
}
