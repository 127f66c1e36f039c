package com.lendingengine.common.exception;

/**
 * Thrown when a withdrawal exceeds the recorded balance of an account.
 */
public class InsufficientBalanceException extends LendingEngineException {

    public InsufficientBalanceException(String account, long requested, long available) {
        super(LendingErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance for account %s. Requested: %d, Available: %d",
                account, requested, available));
    }
}
