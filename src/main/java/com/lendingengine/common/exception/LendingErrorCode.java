package com.lendingengine.common.exception;

/**
 * Stable error codes reported by the engine and exposed through the REST API.
 */
public enum LendingErrorCode {
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_LIQUIDITY,
    COLLATERAL_LIMIT_EXCEEDED,
    NO_ACTIVE_LOAN,
    OVER_REPAYMENT,
    NOT_LIQUIDATABLE,
    TRANSFER_FAILED,
    UNAUTHORIZED,
    REENTRANT_CALL
}
