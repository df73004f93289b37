package com.flagship.pool_settlement.config;

import com.flagship.pool_settlement.liquidity.FixedSeniorYieldTranchesPolicy;
import com.flagship.pool_settlement.liquidity.RiskAdjustedTranchesPolicy;
import com.flagship.pool_settlement.liquidity.SeniorYieldTrackerRepository;
import com.flagship.pool_settlement.liquidity.TranchesPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the tranches policy from {@code pool.tranches-policy.type}.
 */
@Slf4j
@Configuration
public class LiquidityConfig {

    @Bean
    public TranchesPolicy tranchesPolicy(PoolProperties properties, SeniorYieldTrackerRepository trackerRepository) {
        return createTranchesPolicy(properties, trackerRepository);
    }

    public static TranchesPolicy createTranchesPolicy(PoolProperties properties,
                                                      SeniorYieldTrackerRepository trackerRepository) {
        PoolProperties.TranchesPolicy config = properties.getTranchesPolicy();
        TranchesPolicy policy = switch (config.getType()) {
            case FIXED_SENIOR_YIELD -> new FixedSeniorYieldTranchesPolicy(config.getSeniorYieldBps(),
                properties.getName(), trackerRepository);
            case RISK_ADJUSTED -> new RiskAdjustedTranchesPolicy(config.getRiskAdjustmentBps());
        };
        log.info("Using {} tranches policy", policy.getType());
        return policy;
    }
}
