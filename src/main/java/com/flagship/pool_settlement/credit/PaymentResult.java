package com.flagship.pool_settlement.credit;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class PaymentResult {
    String creditId;
    BigDecimal amountPaid;
    BigDecimal incomePaid;
    BigDecimal principalPaid;
    boolean paidOff;
    boolean lossRecovery;
    CreditRecord record;
}
