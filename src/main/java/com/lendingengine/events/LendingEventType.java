package com.lendingengine.events;

/**
 * Kinds of notification emitted by mutating pool operations.
 */
public enum LendingEventType {
    /**
     * Lender supplied base asset to the pool.
     */
    DEPOSIT,

    /**
     * Lender took base asset back out of the pool.
     */
    WITHDRAW,

    /**
     * Borrower locked collateral.
     */
    COLLATERAL_DEPOSIT,

    /**
     * Borrower released collateral no longer backing debt.
     */
    COLLATERAL_WITHDRAW,

    /**
     * Borrower drew base asset against collateral.
     */
    BORROW,

    /**
     * Borrower repaid principal plus interest.
     * Secondary amount carries the interest paid.
     */
    REPAY,

    /**
     * Third party closed out a position.
     * Amount is the debt repaid, secondary amount the collateral seized.
     */
    LIQUIDATE,

    /**
     * Owner changed the fee recipient.
     */
    FEE_RECIPIENT_UPDATED
}
