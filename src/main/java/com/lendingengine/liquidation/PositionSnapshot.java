package com.lendingengine.liquidation;

import com.lendingengine.store.BorrowerRecord;
import lombok.Value;

import java.time.Duration;

/**
 * Read-only view of a borrower position at the moment eligibility is evaluated.
 */
@Value
public class PositionSnapshot {
    BorrowerRecord record;
    Duration loanAge;
    long collateralRatioBps;
    long thresholdRatioBps;
}
