package com.flagship.pool_settlement.redemption;

import lombok.Value;

import java.time.LocalDate;

/**
 * A redemption window. Requests made before {@code endDate} are settled by the close of this epoch.
 */
@Value
public class Epoch {
    long id;
    LocalDate endDate;

    public boolean hasEnded(LocalDate today) {
        return !today.isBefore(endDate);
    }
}
