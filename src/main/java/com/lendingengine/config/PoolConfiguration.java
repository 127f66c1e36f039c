package com.lendingengine.config;

import com.lendingengine.common.BasisPoints;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable construction-time parameters of a lending pool.
 *
 * Ratios are basis points. The fee recipient here is only the initial value; the
 * current one lives in {@link com.lendingengine.store.PoolState} and can be changed
 * by the owner.
 *
 * {@code protocolFeeBps} is informational: it is reported in the pool overview
 * but fees are charged at the per-quarter rates of
 * {@link com.lendingengine.credit.LoanQuarter}.
 */
@Value
public class PoolConfiguration {

    public static final long MIN_COLLATERAL_RATIO_BPS = 5_000L;
    public static final long MAX_COLLATERAL_RATIO_BPS = 9_500L;

    String baseAsset;
    String collateralAsset;
    long collateralRatioBps;
    long protocolFeeBps;
    String feeRecipient;
    String owner;

    /**
     * Account under which the pool holds custody of both assets.
     */
    String poolAccount;

    @Builder
    public PoolConfiguration(String baseAsset, String collateralAsset, long collateralRatioBps,
                             long protocolFeeBps, String feeRecipient, String owner, String poolAccount) {
        requireText(baseAsset, "baseAsset");
        requireText(collateralAsset, "collateralAsset");
        requireText(feeRecipient, "feeRecipient");
        requireText(owner, "owner");
        requireText(poolAccount, "poolAccount");
        if (baseAsset.equals(collateralAsset)) {
            throw new IllegalArgumentException("Base and collateral assets must differ: " + baseAsset);
        }
        BasisPoints.requireInRange(collateralRatioBps, MIN_COLLATERAL_RATIO_BPS, MAX_COLLATERAL_RATIO_BPS,
            "collateralRatio");
        BasisPoints.requireInRange(protocolFeeBps, 0, BasisPoints.ONE_HUNDRED_PERCENT, "protocolFee");

        this.baseAsset = baseAsset;
        this.collateralAsset = collateralAsset;
        this.collateralRatioBps = collateralRatioBps;
        this.protocolFeeBps = protocolFeeBps;
        this.feeRecipient = feeRecipient;
        this.owner = owner;
        this.poolAccount = poolAccount;
    }

    public boolean isOwner(String account) {
        return owner.equals(account);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
