package com.lendingengine.common.exception;

/**
 * Thrown when a caller other than the pool owner attempts an admin operation.
 */
public class UnauthorizedException extends LendingEngineException {

    public UnauthorizedException(String caller, String operation) {
        super(LendingErrorCode.UNAUTHORIZED,
            String.format("Account %s is not allowed to perform '%s'", caller, operation));
    }
}
