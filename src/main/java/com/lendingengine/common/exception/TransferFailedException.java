package com.lendingengine.common.exception;

/**
 * Thrown when an external asset movement fails.
 *
 * Carries the asset and the direction so callers can tell which leg broke.
 */
public class TransferFailedException extends LendingEngineException {

    private final String assetId;
    private final String account;
    private final String operation;

    public TransferFailedException(String message, String assetId, String account, String operation) {
        super(LendingErrorCode.TRANSFER_FAILED, message);
        this.assetId = assetId;
        this.account = account;
        this.operation = operation;
    }

    public TransferFailedException(String message, String assetId, String account, String operation,
                                   Throwable cause) {
        super(LendingErrorCode.TRANSFER_FAILED, message, cause);
        this.assetId = assetId;
        this.account = account;
        this.operation = operation;
    }

    public String getAssetId() {
        return assetId;
    }

    public String getAccount() {
        return account;
    }

    public String getOperation() {
        return operation;
    }
}
