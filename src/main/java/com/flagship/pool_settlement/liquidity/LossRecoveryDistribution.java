package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class LossRecoveryDistribution {
    BigDecimal recovery;
    TrancheAssets trancheRecovered;
    Map<String, BigDecimal> coverRecovered;
    /** Recovery beyond every recorded loss, distributed as profit. */
    BigDecimal leftover;
    ProfitDistribution leftoverDistribution;

    public static LossRecoveryDistribution none() {
        return new LossRecoveryDistribution(Amounts.ZERO, TrancheAssets.ZERO, Map.of(), Amounts.ZERO,
            ProfitDistribution.none());
    }
}
