package com.lendingengine.common.exception;

/**
 * Thrown when the engine is entered again while one of its operations is in flight
 * on the same thread, e.g. from inside an asset transfer callback.
 */
public class ReentrantCallException extends LendingEngineException {

    public ReentrantCallException(String operation, String inFlight) {
        super(LendingErrorCode.REENTRANT_CALL,
            String.format("Cannot start '%s' while '%s' is in progress", operation, inFlight));
    }
}
