package com.flagship.pool_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized event as stored in the journal.
 *
 * Entries are written in the same transaction as the state change they describe,
 * so a rolled back operation leaves no entry behind.
 */
@Value
public class JournalEntry {
    UUID id;
    String aggregateType;
    String aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    long sequenceNumber;
}
