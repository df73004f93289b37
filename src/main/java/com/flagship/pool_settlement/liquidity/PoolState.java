package com.flagship.pool_settlement.liquidity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable snapshot of the pool accumulators. Replaced wholesale on every change.
 */
@Value
@Builder(toBuilder = true)
public class PoolState {
    TrancheAssets assets;
    TrancheAssets losses;
    BigDecimal totalPoolValue;
    BigDecimal shortfall;
    boolean enabled;
}
