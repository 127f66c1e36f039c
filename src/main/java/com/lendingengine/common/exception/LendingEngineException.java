package com.lendingengine.common.exception;

/**
 * Base exception for all lending engine failures.
 *
 * Every failure aborts the whole operation; no partial state change survives it.
 */
public abstract class LendingEngineException extends RuntimeException {

    private final LendingErrorCode errorCode;

    protected LendingEngineException(LendingErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LendingEngineException(LendingErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public LendingErrorCode getErrorCode() {
        return errorCode;
    }
}
