package com.lendingengine.liquidation;

import com.lendingengine.assets.PoolAssets;
import com.lendingengine.assets.TransferBatch;
import com.lendingengine.common.exception.NoActiveLoanException;
import com.lendingengine.common.exception.NotLiquidatableException;
import com.lendingengine.config.PoolConfiguration;
import com.lendingengine.credit.CreditEngine;
import com.lendingengine.credit.InterestRateSchedule;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LedgerStore;
import com.lendingengine.store.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates liquidation rules and closes out eligible positions.
 *
 * Any account may liquidate. The liquidator repays the full outstanding principal
 * and receives all of the borrower's collateral; there is no partial liquidation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationEngine {

    private final LedgerStore ledgerStore;
    private final CreditEngine creditEngine;
    private final InterestRateSchedule schedule;
    private final PoolConfiguration configuration;
    private final PoolAssets poolAssets;
    private final LendingEventService eventService;
    private final List<LiquidationRule> rules;

    @Transactional(readOnly = true)
    public boolean isLiquidatable(String borrower, Instant now) {
        return !getLiquidationReasons(borrower, now).isEmpty();
    }

    /**
     * Every rule that currently fires for the borrower; empty without an active loan.
     */
    @Transactional(readOnly = true)
    public List<LiquidationReason> getLiquidationReasons(String borrower, Instant now) {
        return ledgerStore.findBorrower(borrower)
            .filter(BorrowerRecord::hasActiveLoan)
            .map(record -> evaluate(record, now))
            .orElse(List.of());
    }

    /**
     * Scan every active loan and return the liquidatable ones with their reasons,
     * ordered by borrower account.
     */
    @Transactional(readOnly = true)
    public Map<String, List<LiquidationReason>> findLiquidatable(Instant now) {
        Map<String, List<LiquidationReason>> eligible = new LinkedHashMap<>();
        for (BorrowerRecord record : ledgerStore.findActiveBorrowers()) {
            List<LiquidationReason> reasons = evaluate(record, now);
            if (!reasons.isEmpty()) {
                eligible.put(record.getAccount(), reasons);
            }
        }
        return eligible;
    }

    @Transactional
    public BorrowerRecord liquidate(String liquidator, String borrower, Instant now) {
        BorrowerRecord record = ledgerStore.findBorrower(borrower)
            .filter(BorrowerRecord::hasActiveLoan)
            .orElseThrow(() -> new NoActiveLoanException(borrower));
        List<LiquidationReason> reasons = evaluate(record, now);
        if (reasons.isEmpty()) {
            throw new NotLiquidatableException(borrower);
        }

        long debt = record.getAmountBorrowed();
        long collateral = record.getCollateralDeposited();

        record.setAmountBorrowed(0);
        record.setCollateralDeposited(0);
        record.setBorrowTimestamp(null);
        record.setLastIteration(now);
        PoolState pool = ledgerStore.loadPool();
        pool.setTotalSupplied(Math.addExact(pool.getTotalSupplied(), debt));
        pool.setUpdatedAt(now);
        ledgerStore.saveBorrower(record);
        ledgerStore.savePool(pool);
        eventService.recordLiquidation(liquidator, borrower, debt, collateral, now);
        ledgerStore.flush();

        TransferBatch.create()
            .pull(poolAssets.base(), liquidator, debt)
            .push(poolAssets.collateral(), liquidator, collateral)
            .execute();

        log.info("Liquidator {} closed position of {} ({}): repaid {}, seized {}",
            liquidator, borrower, reasons, debt, collateral);
        return record;
    }

    private List<LiquidationReason> evaluate(BorrowerRecord record, Instant now) {
        PositionSnapshot position = new PositionSnapshot(
            record,
            schedule.loanAge(record.getBorrowTimestamp(), now),
            creditEngine.collateralRatio(record),
            configuration.getCollateralRatioBps()
        );

        List<LiquidationReason> reasons = new ArrayList<>();
        for (LiquidationRule rule : rules) {
            Optional<LiquidationReason> reason = rule.evaluate(position);
            if (reason.isPresent()) {
                log.debug("Rule {} fired for {}: {}", rule.getRuleName(), record.getAccount(), reason.get());
                reasons.add(reason.get());
            }
        }
        return reasons;
    }
}
