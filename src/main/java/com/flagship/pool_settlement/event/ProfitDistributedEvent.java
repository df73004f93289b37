package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Event recorded when profit has been split between fees, covers and tranches.
 */
@Value
public class ProfitDistributedEvent implements PoolEvent {
    UUID eventId;
    String poolName;
    BigDecimal profit;
    BigDecimal poolFees;
    Map<String, BigDecimal> coverProfit;
    BigDecimal seniorProfit;
    BigDecimal juniorProfit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProfitDistributed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_POOL;
    }

    @Override
    public String getAggregateId() {
        return poolName;
    }

    public static ProfitDistributedEvent of(String poolName, BigDecimal profit, BigDecimal poolFees,
                                            Map<String, BigDecimal> coverProfit, BigDecimal seniorProfit,
                                            BigDecimal juniorProfit, Instant occurredAt) {
        return new ProfitDistributedEvent(UUID.randomUUID(), poolName, profit, poolFees,
            Map.copyOf(coverProfit), seniorProfit, juniorProfit, occurredAt);
    }
}
