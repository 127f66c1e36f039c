package com.lendingengine.assets;

/**
 * Value-transfer collaborator for one asset.
 *
 * The engine never holds balances itself: it records who is owed what and asks
 * the adapter to move funds between an account and the pool's custody account.
 *
 * CONTRACT:
 * - pull(from, amount) moves funds from an account into pool custody. The account
 *   must have authorized the pool beforehand (an allowance).
 * - push(to, amount) moves funds out of pool custody to an account.
 * - A failed movement MUST throw
 *   {@link com.lendingengine.common.exception.TransferFailedException}; it is never a
 *   silent no-op.
 * - Implementations MUST NOT call back into the lending engine. The engine rejects
 *   such calls with {@link com.lendingengine.common.exception.ReentrantCallException}.
 */
public interface AssetTransferAdapter {

    /**
     * Identifier of the asset this adapter moves.
     */
    String getAssetId();

    /**
     * Pull funds from an account into pool custody.
     *
     * @param from account paying into the pool
     * @param amount positive amount in asset units
     * @throws com.lendingengine.common.exception.TransferFailedException if the funds could not be moved
     */
    void pull(String from, long amount);

    /**
     * Push funds from pool custody to an account.
     *
     * @param to account receiving the funds
     * @param amount positive amount in asset units
     * @throws com.lendingengine.common.exception.TransferFailedException if the funds could not be moved
     */
    void push(String to, long amount);

    /**
     * Current balance of an account in this asset.
     */
    long balanceOf(String account);
}
