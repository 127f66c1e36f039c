package com.lendingengine.config;

import com.lendingengine.assets.InMemoryAssetLedger;
import com.lendingengine.assets.PoolAssets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pool parameters, the clock and the asset collaborators.
 *
 * The default asset collaborators are in-memory ledgers so the service runs
 * stand-alone. A deployment backed by real asset rails replaces the
 * {@link PoolAssets} bean.
 */
@Configuration
@Slf4j
public class LendingEngineConfig {

    @Bean
    public PoolConfiguration poolConfiguration(
            @Value("${lending-engine.pool.base-asset:BASE}") String baseAsset,
            @Value("${lending-engine.pool.collateral-asset:COLLATERAL}") String collateralAsset,
            @Value("${lending-engine.pool.collateral-ratio-bps:8000}") long collateralRatioBps,
            @Value("${lending-engine.pool.protocol-fee-bps:100}") long protocolFeeBps,
            @Value("${lending-engine.pool.fee-recipient:treasury}") String feeRecipient,
            @Value("${lending-engine.pool.owner:owner}") String owner,
            @Value("${lending-engine.pool.account:lending-pool}") String poolAccount) {
        PoolConfiguration configuration = PoolConfiguration.builder()
            .baseAsset(baseAsset)
            .collateralAsset(collateralAsset)
            .collateralRatioBps(collateralRatioBps)
            .protocolFeeBps(protocolFeeBps)
            .feeRecipient(feeRecipient)
            .owner(owner)
            .poolAccount(poolAccount)
            .build();

        log.info("Lending pool configured: base={}, collateral={}, ratio={}bps, fee={}bps, owner={}",
            baseAsset, collateralAsset, collateralRatioBps, protocolFeeBps, owner);
        return configuration;
    }

    @Bean
    public PoolAssets poolAssets(PoolConfiguration configuration) {
        return new PoolAssets(
            new InMemoryAssetLedger(configuration.getBaseAsset(), configuration.getPoolAccount()),
            new InMemoryAssetLedger(configuration.getCollateralAsset(), configuration.getPoolAccount())
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
