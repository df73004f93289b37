package com.flagship.pool_settlement.credit;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class DrawdownResult {
    String creditId;
    BigDecimal amount;
    BigDecimal frontLoadingFee;
    /** What the borrower actually received. */
    BigDecimal netAmount;
    CreditRecord record;
}
