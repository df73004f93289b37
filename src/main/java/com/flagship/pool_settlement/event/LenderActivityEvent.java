package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded for lender facing vault activity: deposits, redemption
 * requests, cancellations and disbursements.
 */
@Value
public class LenderActivityEvent implements PoolEvent {
    UUID eventId;
    String tranche;
    String lender;
    Activity activity;
    BigDecimal shares;
    BigDecimal amount;
    long epochId;
    Instant occurredAt;

    public enum Activity {
        DEPOSIT,
        REDEMPTION_REQUESTED,
        REDEMPTION_CANCELLED,
        DISBURSED
    }

    @Override
    public String getEventType() {
        return "Lender" + activity.name();
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TRANCHE;
    }

    @Override
    public String getAggregateId() {
        return tranche;
    }

    public static LenderActivityEvent of(String tranche, String lender, Activity activity, BigDecimal shares,
                                         BigDecimal amount, long epochId, Instant occurredAt) {
        return new LenderActivityEvent(UUID.randomUUID(), tranche, lender, activity, shares, amount, epochId,
            occurredAt);
    }
}
