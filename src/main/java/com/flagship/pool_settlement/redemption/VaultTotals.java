package com.flagship.pool_settlement.redemption;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Share supply of a tranche. Escrowed shares are part of the supply.
 */
@Value
public class VaultTotals {
    BigDecimal totalSupply;
    BigDecimal escrowedShares;

    public VaultTotals withSupply(BigDecimal supply) {
        return new VaultTotals(supply, escrowedShares);
    }

    public VaultTotals withEscrow(BigDecimal escrow) {
        return new VaultTotals(totalSupply, escrow);
    }
}
