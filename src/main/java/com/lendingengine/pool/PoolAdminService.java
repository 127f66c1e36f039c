package com.lendingengine.pool;

import com.lendingengine.common.Amounts;
import com.lendingengine.common.exception.UnauthorizedException;
import com.lendingengine.config.PoolConfiguration;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.store.LedgerStore;
import com.lendingengine.store.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Owner-only state transitions on the pool.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolAdminService {

    private final PoolConfiguration configuration;
    private final LedgerStore ledgerStore;
    private final LendingEventService eventService;

    @Transactional
    public PoolState updateFeeRecipient(String caller, String newRecipient, Instant now) {
        if (!configuration.isOwner(caller)) {
            throw new UnauthorizedException(caller, "updateFeeRecipient");
        }
        Amounts.requireAccount(newRecipient);

        PoolState pool = ledgerStore.loadPool();
        String previous = pool.getFeeRecipient();
        pool.setFeeRecipient(newRecipient);
        pool.setUpdatedAt(now);
        ledgerStore.savePool(pool);
        eventService.recordFeeRecipientUpdate(caller, newRecipient, now);

        log.info("Fee recipient changed from {} to {} by {}", previous, newRecipient, caller);
        return pool;
    }

    @Transactional(readOnly = true)
    public PoolOverview getOverview() {
        PoolState pool = ledgerStore.viewPool();
        return PoolOverview.builder()
            .baseAsset(configuration.getBaseAsset())
            .collateralAsset(configuration.getCollateralAsset())
            .collateralRatioBps(configuration.getCollateralRatioBps())
            .protocolFeeBps(configuration.getProtocolFeeBps())
            .feeRecipient(pool.getFeeRecipient())
            .owner(configuration.getOwner())
            .totalSupplied(pool.getTotalSupplied())
            .build();
    }
}
