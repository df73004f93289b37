package com.flagship.pool_settlement.ledger;

/**
 * Account naming scheme for the custody ledger.
 */
public final class CustodyAccounts {

    public static final String POOL_SAFE = "pool-safe";
    public static final String PROTOCOL_FEES = "fees:protocol";
    public static final String POOL_OWNER_FEES = "fees:pool-owner";
    public static final String EA_FEES = "fees:evaluation-agent";
    public static final String PROTOCOL_TREASURY = "treasury:protocol";
    public static final String POOL_OWNER_TREASURY = "treasury:pool-owner";
    public static final String EA_TREASURY = "treasury:evaluation-agent";

    private CustodyAccounts() {
    }

    public static String borrower(String borrowerId) {
        return "borrower:" + borrowerId;
    }

    public static String lender(String lenderId) {
        return "lender:" + lenderId;
    }

    public static String payer(String payerId) {
        return "payer:" + payerId;
    }

    public static String coverProvider(String providerId) {
        return "cover-provider:" + providerId;
    }

    public static String cover(String coverId) {
        return "cover:" + coverId;
    }

    public static String redemptionReserve(String trancheName) {
        return "redemption-reserve:" + trancheName;
    }
}
