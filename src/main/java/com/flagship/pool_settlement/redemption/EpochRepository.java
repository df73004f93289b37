package com.flagship.pool_settlement.redemption;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Redemption epochs. Exactly one epoch is OPEN at a time.
 */
@Repository
public class EpochRepository {

    static final String OPEN = "OPEN";
    static final String SETTLING = "SETTLING";
    static final String CLOSED = "CLOSED";

    private final JdbcTemplate jdbcTemplate;

    public EpochRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Epoch> findOpen() {
        return jdbcTemplate.query(
            "SELECT epoch_id, end_date FROM epochs WHERE status = ?",
            epochRowMapper(),
            OPEN
        ).stream().findFirst();
    }

    public void insertOpen(Epoch epoch) {
        jdbcTemplate.update(
            "INSERT INTO epochs (epoch_id, end_date, status) VALUES (?, ?, ?)",
            epoch.getId(), Date.valueOf(epoch.getEndDate()), OPEN
        );
    }

    /**
     * Moves the epoch from OPEN to SETTLING. The update waits for the row lock
     * of any concurrent close and then finds the epoch no longer open.
     *
     * @return false if the epoch was not open anymore
     */
    public boolean claimForSettlement(long epochId) {
        return jdbcTemplate.update(
            "UPDATE epochs SET status = ? WHERE epoch_id = ? AND status = ?",
            SETTLING, epochId, OPEN
        ) == 1;
    }

    public void markClosed(long epochId, Instant closedAt) {
        jdbcTemplate.update(
            "UPDATE epochs SET status = ?, closed_at = ? WHERE epoch_id = ?",
            CLOSED, Timestamp.from(closedAt), epochId
        );
    }

    private RowMapper<Epoch> epochRowMapper() {
        return (rs, rowNum) -> new Epoch(rs.getLong("epoch_id"), rs.getDate("end_date").toLocalDate());
    }
}
