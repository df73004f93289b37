package com.flagship.pool_settlement.ledger;

/**
 * Side of a custody ledger entry. A debit moves value into an account, a credit moves it out.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
