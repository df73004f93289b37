package com.flagship.pool_settlement;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that can be moved forward between operations.
 */
public class MutableClock extends Clock {

    private Instant instant;

    public MutableClock(LocalDate date) {
        this.instant = date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public void setDate(LocalDate date) {
        this.instant = date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public void advanceDays(long days) {
        this.instant = instant.plusSeconds(days * 86_400);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
