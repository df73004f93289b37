package com.flagship.pool_settlement.config;

import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.liquidity.TranchesPolicyType;
import com.flagship.pool_settlement.redemption.RedemptionPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pool configuration bound from the {@code pool.*} namespace.
 *
 * Rates are in basis points. Amounts are in the pool's settlement unit.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pool")
public class PoolProperties {

    @NotBlank
    private String name = "default-pool";

    @NotNull
    private PayPeriodDuration payPeriodDuration = PayPeriodDuration.MONTHLY;

    /**
     * Senior assets may be at most this multiple of junior assets. Zero disables the check.
     */
    @Min(0)
    private int maxSeniorJuniorRatio = 4;

    @NotNull
    private BigDecimal liquidityCap = new BigDecimal("1000000000");

    @Valid
    private TranchesPolicy tranchesPolicy = new TranchesPolicy();

    @Valid
    private Fees fees = new Fees();

    @Valid
    private List<FirstLossCover> firstLossCovers = new ArrayList<>();

    @Valid
    private Credit credit = new Credit();

    @Valid
    private Redemption redemption = new Redemption();

    private Scheduler scheduler = new Scheduler();

    @Getter
    @Setter
    public static class TranchesPolicy {
        private TranchesPolicyType type = TranchesPolicyType.FIXED_SENIOR_YIELD;
        /** Annual senior yield for the fixed policy. */
        @Min(0)
        private int seniorYieldBps = 1000;
        /** Share of the senior's proportional profit handed to junior under the risk adjusted policy. */
        @Min(0)
        @Max(10000)
        private int riskAdjustmentBps = 2000;
    }

    @Getter
    @Setter
    public static class Fees {
        @Min(0)
        @Max(10000)
        private int protocolFeeBps = 1000;
        @Min(0)
        @Max(10000)
        private int poolOwnerRewardBps = 0;
        @Min(0)
        @Max(10000)
        private int eaRewardBps = 0;
        /** Fixed fee taken from every profit distribution before the rate based fees. */
        private BigDecimal flatFee = BigDecimal.ZERO;
    }

    @Getter
    @Setter
    public static class FirstLossCover {
        @NotBlank
        private String id;
        private int rank;
        @NotNull
        private BigDecimal maxLiquidity = BigDecimal.ZERO;
        @Min(0)
        @Max(10000)
        private int coverRateBps = 10000;
        @NotNull
        private BigDecimal coverCapPerLoss = BigDecimal.ZERO;
        /** Weight of cover assets when sharing profit with tranches. Zero means no profit share. */
        @Min(0)
        private int riskYieldMultiplierBps = 0;
    }

    @Getter
    @Setter
    public static class Credit {
        private BigDecimal frontLoadingFeeFlat = BigDecimal.ZERO;
        @Min(0)
        @Max(10000)
        private int frontLoadingFeeBps = 0;
        private BigDecimal lateFeeFlat = BigDecimal.ZERO;
        @Min(0)
        @Max(10000)
        private int lateFeeBps = 0;
        /** Share of unbilled principal billed each period. Zero means interest only until maturity. */
        @Min(0)
        @Max(10000)
        private int principalRateBps = 0;
        @Min(0)
        @Max(10000)
        private int advanceRateBps = 8000;
        @Min(1)
        private int delayedAfterMissedPeriods = 1;
        @Min(1)
        private int defaultAfterMissedPeriods = 3;
    }

    @Getter
    @Setter
    public static class Redemption {
        private RedemptionPriority priority = RedemptionPriority.SENIOR_FIRST;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean epochCloseEnabled = false;
        private long epochCheckIntervalMs = 60_000;
        private boolean billingRefreshEnabled = false;
        private long billingRefreshIntervalMs = 3_600_000;
    }
}
