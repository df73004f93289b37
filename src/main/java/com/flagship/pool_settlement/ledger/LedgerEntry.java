package com.flagship.pool_settlement.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A single debit or credit line in the custody ledger. Entries are never edited.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    String accountName;
    BigDecimal amount;
    EntryType entryType;
    String description;
    long sequenceNumber;
}
