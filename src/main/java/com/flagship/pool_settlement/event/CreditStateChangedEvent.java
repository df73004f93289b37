package com.flagship.pool_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded whenever a credit record moves between lifecycle states.
 */
@Value
public class CreditStateChangedEvent implements PoolEvent {
    UUID eventId;
    String creditId;
    String fromState;
    String toState;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditStateChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_CREDIT;
    }

    @Override
    public String getAggregateId() {
        return creditId;
    }

    public static CreditStateChangedEvent of(String creditId, String fromState, String toState, String reason,
                                             Instant occurredAt) {
        return new CreditStateChangedEvent(UUID.randomUUID(), creditId, fromState, toState, reason, occurredAt);
    }
}
