package com.flagship.pool_settlement.credit;

/**
 * Lifecycle state of a credit record.
 */
public enum CreditState {
    /**
     * Approved but nothing drawn yet.
     */
    APPROVED,

    /**
     * Drawn and current on every bill.
     */
    GOOD_STANDING,

    /**
     * At least one bill went unpaid past its due date.
     * Returns to GOOD_STANDING once all past due amounts are paid.
     */
    DELAYED,

    /**
     * Enough periods were missed to write the principal off as a loss.
     * Further payments are loss recoveries.
     */
    DEFAULTED,

    /**
     * Paid off at maturity, written off, or closed before any drawdown.
     * Terminal state - no further transitions allowed.
     */
    CLOSED
}
