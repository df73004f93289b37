package com.flagship.pool_settlement.observability;

import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.liquidity.PoolState;
import com.flagship.pool_settlement.redemption.EpochManager;
import com.flagship.pool_settlement.redemption.Epoch;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Custom health indicators for the pool settlement engine.
 */
public class HealthIndicators {

    /**
     * Pool books. DOWN when the value invariant is broken, OUT_OF_SERVICE while
     * the pool is disabled, WARNING when losses left a shortfall.
     */
    @Component("poolHealth")
    public static class PoolHealthIndicator implements HealthIndicator {

        private final Pool pool;

        public PoolHealthIndicator(Pool pool) {
            this.pool = pool;
        }

        @Override
        public Health health() {
            try {
                PoolState state = pool.getState();
                boolean invariantHolds = pool.checkValueInvariant();

                Health.Builder builder = !invariantHolds
                        ? Health.down()
                        : !state.isEnabled()
                        ? Health.outOfService()
                        : state.getShortfall().signum() > 0
                        ? Health.status("WARNING")
                        : Health.up();

                return builder
                        .withDetail("enabled", state.isEnabled())
                        .withDetail("totalPoolValue", state.getTotalPoolValue())
                        .withDetail("shortfall", state.getShortfall())
                        .withDetail("valueInvariant", invariantHolds)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Flags an epoch that is past its end date and still waiting to be closed.
     */
    @Component("epochHealth")
    public static class EpochHealthIndicator implements HealthIndicator {

        private final EpochManager epochManager;
        private final Clock clock;

        public EpochHealthIndicator(EpochManager epochManager, Clock clock) {
            this.epochManager = epochManager;
            this.clock = clock;
        }

        @Override
        public Health health() {
            Epoch epoch = epochManager.currentEpoch();
            boolean overdue = epoch.hasEnded(LocalDate.now(clock));
            return (overdue ? Health.status("WARNING") : Health.up())
                    .withDetail("epochId", epoch.getId())
                    .withDetail("endDate", epoch.getEndDate().toString())
                    .withDetail("closeOverdue", overdue)
                    .build();
        }
    }
}
