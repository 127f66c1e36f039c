package com.lendingengine.common.exception;

/**
 * Thrown when the pool does not hold enough liquidity for a borrow or withdrawal.
 */
public class InsufficientLiquidityException extends LendingEngineException {

    public InsufficientLiquidityException(long requested, long available) {
        super(LendingErrorCode.INSUFFICIENT_LIQUIDITY,
            String.format("Insufficient pool liquidity. Requested: %d, Available: %d",
                requested, available));
    }
}
