package com.lendingengine.common.exception;

/**
 * Thrown when a liquidation is attempted on a position that is healthy.
 */
public class NotLiquidatableException extends LendingEngineException {

    public NotLiquidatableException(String borrower) {
        super(LendingErrorCode.NOT_LIQUIDATABLE, "Position is not liquidatable: " + borrower);
    }
}
