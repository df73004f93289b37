package com.flagship.pool_settlement.redemption;

/**
 * How available liquidity is shared between tranches at epoch close.
 */
public enum RedemptionPriority {
    /**
     * Senior requests are filled first; junior receives what is left.
     */
    SENIOR_FIRST,
    /**
     * Liquidity is split in proportion to each tranche's requested amount.
     */
    PRO_RATA
}
