package com.flagship.pool_settlement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events recorded in the {@link EventJournal}.
 *
 * All events share these common properties:
 * - Event ID for deduplication
 * - Aggregate type and id (pool, credit, tranche, epoch)
 * - Timestamp of when the event occurred
 */
public interface PoolEvent {

    String AGGREGATE_POOL = "Pool";
    String AGGREGATE_CREDIT = "Credit";
    String AGGREGATE_TRANCHE = "Tranche";
    String AGGREGATE_EPOCH = "Epoch";

    UUID getEventId();

    String getAggregateType();

    String getAggregateId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
