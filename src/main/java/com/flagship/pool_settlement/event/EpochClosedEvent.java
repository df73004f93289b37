package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Event recorded when an epoch is settled.
 */
@Value
public class EpochClosedEvent implements PoolEvent {
    UUID eventId;
    long epochId;
    BigDecimal seniorSharesProcessed;
    BigDecimal seniorAmountProcessed;
    BigDecimal juniorSharesProcessed;
    BigDecimal juniorAmountProcessed;
    long nextEpochId;
    LocalDate nextEpochEndDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EpochClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_EPOCH;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(epochId);
    }

    public static EpochClosedEvent of(long epochId, BigDecimal seniorShares, BigDecimal seniorAmount,
                                      BigDecimal juniorShares, BigDecimal juniorAmount, long nextEpochId,
                                      LocalDate nextEpochEndDate, Instant occurredAt) {
        return new EpochClosedEvent(UUID.randomUUID(), epochId, seniorShares, seniorAmount, juniorShares,
            juniorAmount, nextEpochId, nextEpochEndDate, occurredAt);
    }
}
