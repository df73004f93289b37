package com.flagship.pool_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentMadeEvent implements PoolEvent {
    UUID eventId;
    String creditId;
    String payer;
    BigDecimal amountPaid;
    BigDecimal incomePaid;
    BigDecimal principalPaid;
    boolean lossRecovery;
    boolean paidOff;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentMade";

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

    public static PaymentMadeEvent of(String creditId, String payer, BigDecimal amountPaid, BigDecimal incomePaid,
                                      BigDecimal principalPaid, boolean lossRecovery, boolean paidOff,
                                      Instant occurredAt) {
        return new PaymentMadeEvent(UUID.randomUUID(), creditId, payer, amountPaid, incomePaid, principalPaid,
            lossRecovery, paidOff, occurredAt);
    }
}
