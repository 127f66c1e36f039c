package com.lendingengine.liquidation;

/**
 * Why a position may be liquidated.
 */
public enum LiquidationReason {
    /**
     * Loan older than 365 days.
     */
    MATURITY_EXCEEDED,

    /**
     * Collateral ratio below the pool threshold.
     */
    UNDERCOLLATERALIZED,

    /**
     * Third quarter of the loan with less than 25% of lifetime principal repaid.
     */
    THIRD_QUARTER_REPAYMENT_SHORTFALL,

    /**
     * Final quarter of the loan with less than 50% of lifetime principal repaid.
     */
    FOURTH_QUARTER_REPAYMENT_SHORTFALL
}
