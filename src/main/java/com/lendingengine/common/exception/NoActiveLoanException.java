package com.lendingengine.common.exception;

/**
 * Thrown when an operation requires an outstanding loan and the borrower has none.
 */
public class NoActiveLoanException extends LendingEngineException {

    public NoActiveLoanException(String account) {
        super(LendingErrorCode.NO_ACTIVE_LOAN, "No active loan for account " + account);
    }
}
