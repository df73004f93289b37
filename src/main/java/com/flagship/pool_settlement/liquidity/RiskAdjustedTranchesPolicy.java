package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Splits profit in proportion to tranche assets, then moves riskAdjustmentBps
 * of the senior share over to junior as compensation for taking losses first.
 */
@RequiredArgsConstructor
public class RiskAdjustedTranchesPolicy implements TranchesPolicy {

    private final int riskAdjustmentBps;

    @Override
    public TranchesPolicyType getType() {
        return TranchesPolicyType.RISK_ADJUSTED;
    }

    @Override
    public TrancheAssets distProfitToTranches(BigDecimal profit, TrancheAssets assets, LocalDate today) {
        if (assets.total().signum() <= 0) {
            return TrancheAssets.of(Amounts.ZERO, profit);
        }
        BigDecimal seniorProportional = Amounts.mulDiv(profit, assets.getSenior(), assets.total());
        BigDecimal adjustment = Amounts.bps(seniorProportional, riskAdjustmentBps);
        BigDecimal seniorProfit = seniorProportional.subtract(adjustment);
        return TrancheAssets.of(seniorProfit, profit.subtract(seniorProfit));
    }
}
