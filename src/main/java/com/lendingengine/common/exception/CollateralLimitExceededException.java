package com.lendingengine.common.exception;

/**
 * Thrown when a position would exceed the borrowing capacity of its collateral.
 */
public class CollateralLimitExceededException extends LendingEngineException {

    public CollateralLimitExceededException(String account, long requestedDebt, long maxBorrowable) {
        super(LendingErrorCode.COLLATERAL_LIMIT_EXCEEDED,
            String.format("Collateral limit exceeded for account %s. Debt would be %d, limit is %d",
                account, requestedDebt, maxBorrowable));
    }
}
