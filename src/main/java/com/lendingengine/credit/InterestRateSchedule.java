package com.lendingengine.credit;

import com.lendingengine.common.BasisPoints;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Maps loan age to a {@link LoanQuarter} and computes interest and fees.
 *
 * Age is measured from {@code borrowTimestamp} to the time of the operation.
 * Quarter boundaries are inclusive at the top: exactly 90 days is still Q1.
 */
@Component
public class InterestRateSchedule {

    public static final Duration QUARTER = Duration.ofDays(90);
    public static final Duration MATURITY = Duration.ofDays(365);

    public LoanQuarter quarterFor(Duration loanAge) {
        for (LoanQuarter quarter : LoanQuarter.values()) {
            if (loanAge.compareTo(Duration.ofDays(quarter.getUpperBoundDays())) <= 0) {
                return quarter;
            }
        }
        return LoanQuarter.Q4;
    }

    public LoanQuarter quarterFor(Instant borrowTimestamp, Instant now) {
        return quarterFor(loanAge(borrowTimestamp, now));
    }

    /**
     * Interest owed on {@code principal} for a loan in the given quarter.
     */
    public long interest(long principal, LoanQuarter quarter) {
        return BasisPoints.apply(principal, quarter.getInterestRateBps());
    }

    /**
     * Protocol fee carved out of {@code interest} when a loan closes in the given quarter.
     */
    public long fee(long interest, LoanQuarter quarter) {
        return BasisPoints.apply(interest, quarter.getFeeRateBps());
    }

    /**
     * Age of a loan. A timestamp in the future counts as age zero.
     */
    public Duration loanAge(Instant borrowTimestamp, Instant now) {
        if (borrowTimestamp == null || now.isBefore(borrowTimestamp)) {
            return Duration.ZERO;
        }
        return Duration.between(borrowTimestamp, now);
    }
}
