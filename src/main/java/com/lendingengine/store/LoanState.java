package com.lendingengine.store;

/**
 * Lifecycle of a borrower's loan.
 */
public enum LoanState {
    /**
     * Nothing outstanding. Collateral may still be deposited.
     */
    NO_LOAN,

    /**
     * Principal outstanding; interest accrues by loan age.
     */
    ACTIVE
}
