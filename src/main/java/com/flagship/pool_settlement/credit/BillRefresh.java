package com.flagship.pool_settlement.credit;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BillRefresh {
    CreditRecord record;
    int periodsRolled;
    BigDecimal lateFeesCharged;
    /** Missed periods reached the default threshold. */
    boolean defaultDue;
}
