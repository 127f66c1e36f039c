package com.lendingengine.common.exception;

/**
 * Thrown when an amount is zero or otherwise malformed.
 */
public class InvalidAmountException extends LendingEngineException {

    public InvalidAmountException(String operation, long amount) {
        super(LendingErrorCode.INVALID_AMOUNT,
            String.format("Invalid amount for %s: %d", operation, amount));
    }
}
