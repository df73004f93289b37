package com.flagship.pool_settlement.calendar;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Length of a billing or epoch period. Periods are aligned to calendar months.
 */
@Getter
@RequiredArgsConstructor
public enum PayPeriodDuration {
    MONTHLY(1),
    QUARTERLY(3),
    SEMI_ANNUALLY(6);

    private final int months;

    public int days() {
        return months * Calendar.DAYS_IN_A_MONTH;
    }
}
