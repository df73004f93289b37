package com.flagship.pool_settlement.liquidity;

public enum TranchesPolicyType {
    FIXED_SENIOR_YIELD,
    RISK_ADJUSTED
}
