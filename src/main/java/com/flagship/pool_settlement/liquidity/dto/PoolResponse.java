package com.flagship.pool_settlement.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_settlement.liquidity.FirstLossCover;
import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.liquidity.PoolState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the pool's books.
 */
@Value
@Builder
public class PoolResponse {

    @JsonProperty("enabled")
    boolean enabled;

    @JsonProperty("total_pool_value")
    BigDecimal totalPoolValue;

    @JsonProperty("senior_assets")
    BigDecimal seniorAssets;

    @JsonProperty("junior_assets")
    BigDecimal juniorAssets;

    @JsonProperty("senior_losses")
    BigDecimal seniorLosses;

    @JsonProperty("junior_losses")
    BigDecimal juniorLosses;

    @JsonProperty("cover_assets")
    Map<String, BigDecimal> coverAssets;

    @JsonProperty("shortfall")
    BigDecimal shortfall;

    @JsonProperty("available_liquidity")
    BigDecimal availableLiquidity;

    @JsonProperty("value_invariant_holds")
    boolean valueInvariantHolds;

    public static PoolResponse from(Pool pool, List<FirstLossCover> covers) {
        PoolState state = pool.getState();
        Map<String, BigDecimal> coverAssets = new LinkedHashMap<>();
        for (FirstLossCover cover : covers) {
            coverAssets.put(cover.getCoverId(), cover.getCoverAssets());
        }
        return PoolResponse.builder()
            .enabled(state.isEnabled())
            .totalPoolValue(state.getTotalPoolValue())
            .seniorAssets(state.getAssets().getSenior())
            .juniorAssets(state.getAssets().getJunior())
            .seniorLosses(state.getLosses().getSenior())
            .juniorLosses(state.getLosses().getJunior())
            .coverAssets(coverAssets)
            .shortfall(state.getShortfall())
            .availableLiquidity(pool.availableLiquidity())
            .valueInvariantHolds(pool.checkValueInvariant())
            .build();
    }
}
