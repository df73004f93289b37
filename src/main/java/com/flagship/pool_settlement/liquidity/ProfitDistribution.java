package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class ProfitDistribution {
    BigDecimal profit;
    PoolFeeDistribution poolFees;
    Map<String, BigDecimal> coverProfit;
    TrancheAssets trancheProfit;

    public static ProfitDistribution none() {
        return new ProfitDistribution(Amounts.ZERO, PoolFeeDistribution.NONE, Map.of(), TrancheAssets.ZERO);
    }
}
