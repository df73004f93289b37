package com.flagship.pool_settlement.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_settlement.liquidity.FeeSchedule;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class FeeScheduleRequest {

    @Min(0) @Max(10_000)
    @JsonProperty("protocol_fee_bps")
    int protocolFeeBps;

    @Min(0) @Max(10_000)
    @JsonProperty("pool_owner_reward_bps")
    int poolOwnerRewardBps;

    @Min(0) @Max(10_000)
    @JsonProperty("ea_reward_bps")
    int eaRewardBps;

    @NotNull(message = "Flat fee is required")
    @DecimalMin(value = "0", message = "Flat fee must not be negative")
    @JsonProperty("flat_fee")
    BigDecimal flatFee;

    public FeeSchedule toFeeSchedule() {
        return FeeSchedule.builder()
            .protocolFeeBps(protocolFeeBps)
            .poolOwnerRewardBps(poolOwnerRewardBps)
            .eaRewardBps(eaRewardBps)
            .flatFee(flatFee)
            .build();
    }
}
