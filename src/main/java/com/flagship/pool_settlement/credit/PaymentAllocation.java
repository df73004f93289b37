package com.flagship.pool_settlement.credit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * How one payment was applied to a credit's buckets.
 *
 * incomePaid (late fees plus yield) is pool profit; principalPaid is not.
 */
@Value
public class PaymentAllocation {
    CreditRecord record;
    BigDecimal amountPaid;
    BigDecimal lateFeePaid;
    BigDecimal yieldPaid;
    BigDecimal principalPaid;
    boolean paidOff;

    public BigDecimal getIncomePaid() {
        return lateFeePaid.add(yieldPaid);
    }
}
