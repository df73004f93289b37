package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Event recorded when a loss has been absorbed by covers and tranches.
 *
 * A non-zero shortfall means the loss exceeded every cover and both tranches.
 */
@Value
public class LossDistributedEvent implements PoolEvent {
    UUID eventId;
    String poolName;
    BigDecimal loss;
    Map<String, BigDecimal> coverLoss;
    BigDecimal juniorLoss;
    BigDecimal seniorLoss;
    BigDecimal shortfall;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LossDistributed";

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

    public static LossDistributedEvent of(String poolName, BigDecimal loss, Map<String, BigDecimal> coverLoss,
                                          BigDecimal juniorLoss, BigDecimal seniorLoss, BigDecimal shortfall,
                                          Instant occurredAt) {
        return new LossDistributedEvent(UUID.randomUUID(), poolName, loss, Map.copyOf(coverLoss),
            juniorLoss, seniorLoss, shortfall, occurredAt);
    }
}
