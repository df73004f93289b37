package com.flagship.pool_settlement.credit;

import lombok.Value;

@Value
public class PrincipalPaymentAndDrawdownResult {
    PaymentResult payment;
    DrawdownResult drawdown;
}
