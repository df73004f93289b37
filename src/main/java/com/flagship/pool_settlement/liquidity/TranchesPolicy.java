package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides how profit, losses and recoveries are split between the senior and
 * junior tranches.
 *
 * Losses always hit junior before senior, and recoveries always repay senior
 * before junior. Implementations only choose how profit is split.
 */
public interface TranchesPolicy {

    TranchesPolicyType getType();

    /**
     * Splits profit (already net of fees and cover shares) between the tranches.
     * The two parts always add up to the profit.
     */
    TrancheAssets distProfitToTranches(BigDecimal profit, TrancheAssets assets, LocalDate today);

    /**
     * Brings time based state (such as accrued senior yield) up to date before
     * tranche assets change.
     */
    default void refreshYieldTracker(TrancheAssets assets, LocalDate today) {
    }

    /**
     * Profit share for each cover, weighted by its risk-yield multiplier against
     * the tranche assets. Covers with a zero multiplier get nothing.
     */
    default Map<String, BigDecimal> distProfitToFirstLossCovers(BigDecimal profit, TrancheAssets assets,
                                                               List<FirstLossCover> covers) {
        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        BigDecimal weighted = covers.stream()
            .map(FirstLossCover::riskWeightedAssets)
            .reduce(Amounts.ZERO, BigDecimal::add);
        if (profit.signum() == 0 || weighted.signum() == 0) {
            return shares;
        }

        BigDecimal denominator = assets.total().add(weighted);
        for (FirstLossCover cover : covers) {
            BigDecimal weight = cover.riskWeightedAssets();
            if (weight.signum() > 0) {
                shares.put(cover.getCoverId(), Amounts.mulDiv(profit, weight, denominator));
            }
        }
        return shares;
    }

    /**
     * Junior absorbs first up to its assets, then senior up to its assets.
     * Whatever is left over is a shortfall the caller must report.
     */
    default TrancheAssets distLossToTranches(BigDecimal loss, TrancheAssets assets) {
        BigDecimal juniorLoss = Amounts.min(loss, Amounts.max(assets.getJunior(), Amounts.ZERO));
        BigDecimal seniorLoss = Amounts.min(loss.subtract(juniorLoss), Amounts.max(assets.getSenior(), Amounts.ZERO));
        return TrancheAssets.of(seniorLoss, juniorLoss);
    }

    /**
     * Senior is repaid first up to its recorded losses, then junior up to its own.
     */
    default TrancheAssets distLossRecoveryToTranches(BigDecimal recovery, TrancheAssets losses) {
        BigDecimal seniorRecovered = Amounts.min(recovery, losses.getSenior());
        BigDecimal juniorRecovered = Amounts.min(recovery.subtract(seniorRecovered), losses.getJunior());
        return TrancheAssets.of(seniorRecovered, juniorRecovered);
    }
}
