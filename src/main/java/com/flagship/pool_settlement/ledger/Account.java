package com.flagship.pool_settlement.ledger;

import lombok.Value;

/**
 * A custody account.
 *
 * INTERNAL accounts hold the pool's own funds and can never go negative.
 * EXTERNAL accounts stand for parties outside the pool (borrowers, lenders,
 * fee recipients, cover providers) and are unbounded.
 */
@Value
public class Account {
    String name;
    AccountType accountType;

    public enum AccountType {
        INTERNAL,
        EXTERNAL
    }

    public boolean isInternal() {
        return accountType == AccountType.INTERNAL;
    }
}
