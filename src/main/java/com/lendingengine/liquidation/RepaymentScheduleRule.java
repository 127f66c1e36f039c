package com.lendingengine.liquidation;

import com.lendingengine.common.BasisPoints;

import java.time.Duration;
import java.util.Optional;

/**
 * Rule that requires a minimum share of lifetime principal to be repaid once a
 * loan reaches a given age window.
 *
 * The window is exclusive at the start and inclusive at the end. The baseline is
 * {@code initialBorrowAmount}, which accumulates across every loan the borrower
 * has ever taken.
 */
public abstract class RepaymentScheduleRule implements LiquidationRule {

    private final Duration windowStart;
    private final Duration windowEnd;
    private final long requiredRepaidBps;
    private final LiquidationReason reason;

    protected RepaymentScheduleRule(long windowStartDays, long windowEndDays, long requiredRepaidBps,
                                    LiquidationReason reason) {
        this.windowStart = Duration.ofDays(windowStartDays);
        this.windowEnd = Duration.ofDays(windowEndDays);
        this.requiredRepaidBps = requiredRepaidBps;
        this.reason = reason;
    }

    @Override
    public Optional<LiquidationReason> evaluate(PositionSnapshot position) {
        Duration age = position.getLoanAge();
        if (age.compareTo(windowStart) <= 0 || age.compareTo(windowEnd) > 0) {
            return Optional.empty();
        }

        long required = BasisPoints.apply(position.getRecord().getInitialBorrowAmount(), requiredRepaidBps);
        if (position.getRecord().getAmountRepaid() < required) {
            return Optional.of(reason);
        }
        return Optional.empty();
    }
}
