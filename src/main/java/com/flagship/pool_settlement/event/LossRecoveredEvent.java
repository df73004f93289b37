package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class LossRecoveredEvent implements PoolEvent {
    UUID eventId;
    String poolName;
    BigDecimal recovery;
    BigDecimal seniorRecovered;
    BigDecimal juniorRecovered;
    Map<String, BigDecimal> coverRecovered;
    BigDecimal leftover;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LossRecovered";

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

    public static LossRecoveredEvent of(String poolName, BigDecimal recovery, BigDecimal seniorRecovered,
                                        BigDecimal juniorRecovered, Map<String, BigDecimal> coverRecovered,
                                        BigDecimal leftover, Instant occurredAt) {
        return new LossRecoveredEvent(UUID.randomUUID(), poolName, recovery, seniorRecovered,
            juniorRecovered, Map.copyOf(coverRecovered), leftover, occurredAt);
    }
}
