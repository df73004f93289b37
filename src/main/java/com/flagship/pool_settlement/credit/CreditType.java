package com.flagship.pool_settlement.credit;

/**
 * Credit variants. Each borrower holds at most one open credit of the line
 * types; factoring credits are keyed by receivable as well.
 */
public enum CreditType {
    CREDIT_LINE,
    RECEIVABLE_BACKED_CREDIT_LINE,
    RECEIVABLE_FACTORING;

    public String creditId(String borrowerId) {
        if (this == RECEIVABLE_FACTORING) {
            throw new IllegalArgumentException("Factoring credits are keyed by receivable");
        }
        return name() + ":" + borrowerId;
    }

    public String creditId(String borrowerId, String receivableId) {
        if (this != RECEIVABLE_FACTORING) {
            return creditId(borrowerId);
        }
        return name() + ":" + borrowerId + ":" + receivableId;
    }
}
