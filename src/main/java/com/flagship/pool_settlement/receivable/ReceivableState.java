package com.flagship.pool_settlement.receivable;

/**
 * Receivable status.
 *
 * PENDING -> APPROVED | REJECTED, APPROVED -> PARTIALLY_PAID | PAID,
 * PARTIALLY_PAID -> PAID. REJECTED and PAID are terminal.
 */
public enum ReceivableState {
    PENDING,
    APPROVED,
    REJECTED,
    PARTIALLY_PAID,
    PAID
}
