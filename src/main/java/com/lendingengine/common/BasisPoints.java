package com.lendingengine.common;

/**
 * Integer basis-point arithmetic. 10000 bps = 100%.
 *
 * All division truncates toward zero, and every multiplication is overflow-checked
 * so a pathological amount surfaces as an {@link ArithmeticException} instead of
 * wrapping silently.
 */
public final class BasisPoints {

    public static final long ONE_HUNDRED_PERCENT = 10_000L;

    private BasisPoints() {
    }

    /**
     * Apply a basis-point rate to an amount: {@code amount * bps / 10000}.
     */
    public static long apply(long amount, long bps) {
        return Math.multiplyExact(amount, bps) / ONE_HUNDRED_PERCENT;
    }

    /**
     * Express {@code numerator} as basis points of {@code denominator}:
     * {@code numerator * 10000 / denominator}.
     */
    public static long ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Denominator must be positive: " + denominator);
        }
        return Math.multiplyExact(numerator, ONE_HUNDRED_PERCENT) / denominator;
    }

    public static void requireInRange(long bps, long min, long max, String name) {
        if (bps < min || bps > max) {
            throw new IllegalArgumentException(
                String.format("%s must be within [%d, %d] bps, got %d", name, min, max, bps));
        }
    }
}
