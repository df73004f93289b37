package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Terms a credit is approved with.
 */
@Value
@Builder
public class CreditConfig {
    BigDecimal creditLimit;
    /** Yield is billed on at least this amount, drawn or not. */
    BigDecimal committedAmount;
    /** Annual yield in basis points. */
    int yieldBps;
    int numOfPeriods;
    PayPeriodDuration payPeriodDuration;
    /** Repaid principal becomes available again. */
    boolean revolving;

    public CreditConfig validate() {
        if (creditLimit == null || creditLimit.signum() <= 0) {
            throw new IllegalArgumentException("creditLimit must be positive");
        }
        if (committedAmount == null || committedAmount.signum() < 0) {
            throw new IllegalArgumentException("committedAmount must not be negative");
        }
        if (committedAmount.compareTo(creditLimit) > 0) {
            throw new IllegalArgumentException("committedAmount must not exceed creditLimit");
        }
        if (yieldBps < 0 || yieldBps > 10_000) {
            throw new IllegalArgumentException("yieldBps must be between 0 and 10000");
        }
        if (numOfPeriods < 1) {
            throw new IllegalArgumentException("numOfPeriods must be at least 1");
        }
        if (payPeriodDuration == null) {
            throw new IllegalArgumentException("payPeriodDuration is required");
        }
        return this;
    }
}
