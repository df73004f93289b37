package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Breakdown behind a credit record's dues.
 *
 * accrued and committed are the current period's yield on drawn principal and
 * on the committed amount; yieldDue is the larger of the two less what was paid.
 */
@Value
@Builder(toBuilder = true)
public class DueDetail {
    BigDecimal accrued;
    BigDecimal committed;
    BigDecimal paid;
    BigDecimal yieldPastDue;
    BigDecimal principalPastDue;
    BigDecimal lateFee;

    public static DueDetail empty() {
        return DueDetail.builder()
            .accrued(Amounts.ZERO)
            .committed(Amounts.ZERO)
            .paid(Amounts.ZERO)
            .yieldPastDue(Amounts.ZERO)
            .principalPastDue(Amounts.ZERO)
            .lateFee(Amounts.ZERO)
            .build();
    }

    public BigDecimal pastDue() {
        return yieldPastDue.add(principalPastDue).add(lateFee);
    }
}
