package com.lendingengine.common.exception;

/**
 * Thrown when a repayment exceeds the outstanding principal.
 */
public class OverRepaymentException extends LendingEngineException {

    public OverRepaymentException(String account, long principal, long outstanding) {
        super(LendingErrorCode.OVER_REPAYMENT,
            String.format("Repayment of %d exceeds outstanding principal %d for account %s",
                principal, outstanding, account));
    }
}
