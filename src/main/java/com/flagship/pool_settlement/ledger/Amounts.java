package com.flagship.pool_settlement.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers shared by every money calculation in the engine.
 *
 * Amounts are carried at 6 decimal places, share prices at 18. All divisions
 * round toward zero so the pool never pays out more than it holds.
 */
public final class Amounts {

    public static final int SCALE = 6;
    public static final int PRICE_SCALE = 18;
    public static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Amounts() {
    }

    public static BigDecimal of(String value) {
        return scale(new BigDecimal(value));
    }

    public static BigDecimal of(long value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    /**
     * amount * bps / 10000, rounded down.
     */
    public static BigDecimal bps(BigDecimal amount, int bps) {
        return scale(amount.multiply(BigDecimal.valueOf(bps)).divide(BPS_DENOMINATOR));
    }

    /**
     * amount * numerator / denominator, rounded down. Returns zero when the denominator is zero.
     */
    public static BigDecimal mulDiv(BigDecimal amount, BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return ZERO;
        }
        return amount.multiply(numerator).divide(denominator, SCALE, RoundingMode.DOWN);
    }

    /**
     * amount * numerator / denominator, rounded up. Returns zero when the denominator is zero.
     */
    public static BigDecimal mulDivUp(BigDecimal amount, BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return ZERO;
        }
        return amount.multiply(numerator).divide(denominator, SCALE, RoundingMode.UP);
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal requirePositive(BigDecimal value, String name) {
        if (!isPositive(value)) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return scale(value);
    }

    public static BigDecimal requireNonNegative(BigDecimal value, String name) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return scale(value);
    }
}
