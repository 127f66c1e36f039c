package com.lendingengine.common;

import com.lendingengine.common.exception.InvalidAmountException;

/**
 * Validation helpers for ledger amounts.
 * Amounts are integer units of the asset involved; zero and negative values are malformed.
 */
public final class Amounts {

    /**
     * Longest account id the ledger tables can store.
     */
    public static final int MAX_ACCOUNT_LENGTH = 255;

    private Amounts() {
    }

    public static void requirePositive(long amount, String operation) {
        if (amount <= 0) {
            throw new InvalidAmountException(operation, amount);
        }
    }

    public static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (account.length() > MAX_ACCOUNT_LENGTH) {
            throw new IllegalArgumentException(
                "Account id longer than " + MAX_ACCOUNT_LENGTH + " characters");
        }
    }
}
