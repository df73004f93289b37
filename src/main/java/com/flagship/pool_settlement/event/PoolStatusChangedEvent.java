package com.flagship.pool_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PoolStatusChangedEvent implements PoolEvent {
    UUID eventId;
    String poolName;
    boolean enabled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PoolStatusChanged";

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

    public static PoolStatusChangedEvent of(String poolName, boolean enabled, Instant occurredAt) {
        return new PoolStatusChangedEvent(UUID.randomUUID(), poolName, enabled, occurredAt);
    }
}
