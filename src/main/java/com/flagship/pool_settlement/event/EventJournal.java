package com.flagship.pool_settlement.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_settlement.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only journal of pool events.
 *
 * Events are written atomically with the state change that produced them:
 * "If the operation commits, the event is guaranteed to be written."
 * If the operation rolls back, the event is rolled back too.
 *
 * Usage: call {@link #record(PoolEvent)} from inside the transaction of the operation.
 */
@Slf4j
@Service
public class EventJournal {

    private static final String SELECT_COLUMNS =
        "SELECT id, aggregate_type, aggregate_id, event_type, payload, correlation_id, created_at, sequence_number " +
        "FROM journal_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public EventJournal(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Records an event within the current transaction.
     *
     * @throws IllegalStateException if called outside a transaction
     */
    public JournalEntry record(PoolEvent event) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Events must be recorded inside a transaction");
        }

        String correlationId = CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null;
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, aggregate_type, aggregate_id, event_type, payload, correlation_id, " +
            "created_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
            event.getEventId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            serializePayload(event),
            correlationId,
            Timestamp.from(event.getOccurredAt())
        );

        log.debug("Recorded event: type={}, aggregateType={}, aggregateId={}",
            event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return jdbcTemplate.queryForObject(SELECT_COLUMNS + "WHERE id = ?", journalEntryRowMapper(),
            event.getEventId());
    }

    public List<JournalEntry> getEventsForAggregate(String aggregateType, String aggregateId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE aggregate_type = ? AND aggregate_id = ? ORDER BY sequence_number",
            journalEntryRowMapper(),
            aggregateType,
            aggregateId
        );
    }

    public List<JournalEntry> getEventsByType(String eventType) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE event_type = ? ORDER BY sequence_number",
            journalEntryRowMapper(),
            eventType
        );
    }

    /**
     * Returns entries with a sequence number greater than the given one, oldest first.
     */
    public List<JournalEntry> getEventsAfter(long sequenceNumber, int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE sequence_number > ? ORDER BY sequence_number LIMIT ?",
            journalEntryRowMapper(),
            sequenceNumber,
            limit
        );
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM journal_entries", Long.class);
        return count != null ? count : 0L;
    }

    private RowMapper<JournalEntry> journalEntryRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            UUID.fromString(rs.getString("id")),
            rs.getString("aggregate_type"),
            rs.getString("aggregate_id"),
            rs.getString("event_type"),
            rs.getString("payload"),
            rs.getString("correlation_id"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
