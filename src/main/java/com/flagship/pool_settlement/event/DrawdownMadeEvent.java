package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded when a borrower draws from a credit.
 *
 * Includes the custody transaction id for consumers that need to correlate
 * with ledger entries.
 */
@Value
public class DrawdownMadeEvent implements PoolEvent {
    UUID eventId;
    String creditId;
    String borrowerId;
    BigDecimal amount;
    BigDecimal frontLoadingFees;
    BigDecimal netAmount;
    UUID ledgerTransactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DrawdownMade";

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

    public static DrawdownMadeEvent of(String creditId, String borrowerId, BigDecimal amount, BigDecimal fees,
                                       BigDecimal netAmount, UUID ledgerTransactionId, Instant occurredAt) {
        return new DrawdownMadeEvent(UUID.randomUUID(), creditId, borrowerId, amount, fees, netAmount,
            ledgerTransactionId, occurredAt);
    }
}
