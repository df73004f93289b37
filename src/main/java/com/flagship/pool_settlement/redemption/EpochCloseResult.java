package com.flagship.pool_settlement.redemption;

import lombok.Value;

@Value
public class EpochCloseResult {
    long closedEpochId;
    EpochRedemptionSummary seniorSummary;
    EpochRedemptionSummary juniorSummary;
    Epoch nextEpoch;
}
