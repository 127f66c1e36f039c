package com.lendingengine.pool;

import lombok.Builder;
import lombok.Value;

/**
 * Pool parameters and liquidity as seen by callers.
 */
@Value
@Builder
public class PoolOverview {
    String baseAsset;
    String collateralAsset;
    long collateralRatioBps;
    long protocolFeeBps;
    String feeRecipient;
    String owner;
    long totalSupplied;
}
