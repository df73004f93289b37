package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.CustodyAccounts;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FeeRecipient {
    PROTOCOL(CustodyAccounts.PROTOCOL_FEES, CustodyAccounts.PROTOCOL_TREASURY),
    POOL_OWNER(CustodyAccounts.POOL_OWNER_FEES, CustodyAccounts.POOL_OWNER_TREASURY),
    EVALUATION_AGENT(CustodyAccounts.EA_FEES, CustodyAccounts.EA_TREASURY);

    private final String feeAccount;
    private final String treasuryAccount;
}
