package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class LossDistribution {
    BigDecimal loss;
    Map<String, BigDecimal> coverLoss;
    TrancheAssets trancheLoss;
    /** Part of the loss nobody could absorb. */
    BigDecimal shortfall;

    public static LossDistribution none() {
        return new LossDistribution(Amounts.ZERO, Map.of(), TrancheAssets.ZERO, Amounts.ZERO);
    }
}
