package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.calendar.Calendar;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Senior earns a fixed annual yield on its assets, accrued daily on 30/360.
 *
 * Profit goes to senior until the accrued yield is paid; the rest goes to
 * junior. Yield the profit could not cover stays unpaid and is settled from
 * later profit first. Callers hold the pool row lock.
 */
@Slf4j
public class FixedSeniorYieldTranchesPolicy implements TranchesPolicy {

    private static final BigDecimal YEAR_BPS =
        BigDecimal.valueOf((long) Calendar.DAYS_IN_A_YEAR * 10_000);

    private final int seniorYieldBps;
    private final String poolName;
    private final SeniorYieldTrackerRepository trackerRepository;

    @Value
    public static class SeniorYieldTracker {
        BigDecimal totalAccrued;
        BigDecimal unpaidYield;
        LocalDate lastUpdatedDate;
    }

    public FixedSeniorYieldTranchesPolicy(int seniorYieldBps, String poolName,
                                          SeniorYieldTrackerRepository trackerRepository) {
        if (seniorYieldBps < 0) {
            throw new IllegalArgumentException("seniorYieldBps must not be negative");
        }
        this.seniorYieldBps = seniorYieldBps;
        this.poolName = poolName;
        this.trackerRepository = trackerRepository;
    }

    @Override
    public TranchesPolicyType getType() {
        return TranchesPolicyType.FIXED_SENIOR_YIELD;
    }

    @Override
    public void refreshYieldTracker(TrancheAssets assets, LocalDate today) {
        SeniorYieldTracker current = trackerRepository.find(poolName);
        if (current.getLastUpdatedDate() == null) {
            trackerRepository.save(poolName,
                new SeniorYieldTracker(current.getTotalAccrued(), current.getUnpaidYield(), today));
            return;
        }
        if (!today.isAfter(current.getLastUpdatedDate())) {
            return;
        }

        long days = Calendar.daysDiff(current.getLastUpdatedDate(), today);
        BigDecimal accrued = assets.getSenior()
            .multiply(BigDecimal.valueOf(seniorYieldBps))
            .multiply(BigDecimal.valueOf(days))
            .divide(YEAR_BPS, Amounts.SCALE, RoundingMode.DOWN);

        log.debug("Senior yield accrued {} over {} days on {}", accrued, days, assets.getSenior());
        trackerRepository.save(poolName, new SeniorYieldTracker(
            current.getTotalAccrued().add(accrued),
            current.getUnpaidYield().add(accrued),
            today));
    }

    @Override
    public TrancheAssets distProfitToTranches(BigDecimal profit, TrancheAssets assets, LocalDate today) {
        refreshYieldTracker(assets, today);

        SeniorYieldTracker current = trackerRepository.find(poolName);
        BigDecimal seniorProfit = Amounts.min(profit, current.getUnpaidYield());
        if (seniorProfit.signum() > 0) {
            trackerRepository.save(poolName, new SeniorYieldTracker(
                current.getTotalAccrued(),
                current.getUnpaidYield().subtract(seniorProfit),
                current.getLastUpdatedDate()));
        }
        return TrancheAssets.of(seniorProfit, profit.subtract(seniorProfit));
    }

    public SeniorYieldTracker getSeniorYieldTracker() {
        return trackerRepository.find(poolName);
    }

    public int getSeniorYieldBps() {
        return seniorYieldBps;
    }
}
