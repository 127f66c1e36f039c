package com.lendingengine.credit;

/**
 * Fixed 90-day brackets of loan age and the rates charged in each.
 *
 * Rates are basis points of the outstanding principal, simple and non-compounding.
 * Q4 also covers loans older than a year.
 */
public enum LoanQuarter {
    Q1(90, 450, 100),
    Q2(180, 800, 150),
    Q3(270, 1050, 200),
    Q4(365, 1300, 250);

    private final long upperBoundDays;
    private final long interestRateBps;
    private final long feeRateBps;

    LoanQuarter(long upperBoundDays, long interestRateBps, long feeRateBps) {
        this.upperBoundDays = upperBoundDays;
        this.interestRateBps = interestRateBps;
        this.feeRateBps = feeRateBps;
    }

    /**
     * Last loan-age day (inclusive) that falls in this quarter.
     */
    public long getUpperBoundDays() {
        return upperBoundDays;
    }

    public long getInterestRateBps() {
        return interestRateBps;
    }

    public long getFeeRateBps() {
        return feeRateBps;
    }
}
