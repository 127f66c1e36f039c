package com.lendingengine.supply;

import com.lendingengine.assets.PoolAssets;
import com.lendingengine.assets.TransferBatch;
import com.lendingengine.common.Amounts;
import com.lendingengine.common.exception.InsufficientBalanceException;
import com.lendingengine.common.exception.InsufficientLiquidityException;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.store.LedgerStore;
import com.lendingengine.store.LenderRecord;
import com.lendingengine.store.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Lender side of the pool: supplying and withdrawing the base asset.
 *
 * Each operation validates, updates the records, journals the event and only then
 * moves funds. A failed transfer throws out of the transaction, which rolls every
 * record change back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplyLedger {

    private final LedgerStore ledgerStore;
    private final PoolAssets poolAssets;
    private final LendingEventService eventService;

    @Transactional
    public LenderRecord deposit(String lender, long amount, Instant now) {
        Amounts.requirePositive(amount, "deposit");

        LenderRecord record = ledgerStore.getOrCreateLender(lender);
        PoolState pool = ledgerStore.loadPool();

        record.setAmountSupplied(Math.addExact(record.getAmountSupplied(), amount));
        record.setDepositTimestamp(now);
        pool.setTotalSupplied(Math.addExact(pool.getTotalSupplied(), amount));
        pool.setUpdatedAt(now);
        ledgerStore.saveLender(record);
        ledgerStore.savePool(pool);
        eventService.recordDeposit(lender, amount, now);
        ledgerStore.flush();

        TransferBatch.create()
            .pull(poolAssets.base(), lender, amount)
            .execute();

        log.info("Lender {} deposited {}; balance={}, totalSupplied={}",
            lender, amount, record.getAmountSupplied(), pool.getTotalSupplied());
        return record;
    }

    @Transactional
    public LenderRecord withdraw(String lender, long amount, Instant now) {
        Amounts.requirePositive(amount, "withdraw");

        LenderRecord record = ledgerStore.findLender(lender)
            .orElseThrow(() -> new InsufficientBalanceException(lender, amount, 0));
        if (amount > record.getAmountSupplied()) {
            throw new InsufficientBalanceException(lender, amount, record.getAmountSupplied());
        }
        PoolState pool = ledgerStore.loadPool();
        if (amount > pool.getTotalSupplied()) {
            throw new InsufficientLiquidityException(amount, pool.getTotalSupplied());
        }

        record.setAmountSupplied(record.getAmountSupplied() - amount);
        pool.setTotalSupplied(pool.getTotalSupplied() - amount);
        pool.setUpdatedAt(now);
        ledgerStore.saveLender(record);
        ledgerStore.savePool(pool);
        eventService.recordWithdraw(lender, amount, now);
        ledgerStore.flush();

        TransferBatch.create()
            .push(poolAssets.base(), lender, amount)
            .execute();

        log.info("Lender {} withdrew {}; balance={}, totalSupplied={}",
            lender, amount, record.getAmountSupplied(), pool.getTotalSupplied());
        return record;
    }

    @Transactional(readOnly = true)
    public long getLenderBalance(String lender) {
        return ledgerStore.findLender(lender)
            .map(LenderRecord::getAmountSupplied)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public long getTotalSupplied() {
        return ledgerStore.viewPool().getTotalSupplied();
    }
}
