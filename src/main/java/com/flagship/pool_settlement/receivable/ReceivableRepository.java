package com.flagship.pool_settlement.receivable;

import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class ReceivableRepository {

    private static final String COLUMNS =
        "SELECT receivable_id, owner_id, amount, paid_amount, drawn_amount, maturity_date, reference_id, state, " +
        "created_at, updated_at FROM receivables ";

    private final JdbcTemplate jdbcTemplate;

    public ReceivableRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Receivable> findById(String receivableId) {
        return jdbcTemplate.query(COLUMNS + "WHERE receivable_id = ?", receivableRowMapper(), receivableId)
            .stream().findFirst();
    }

    /**
     * Reads the receivable with its row locked until the transaction ends.
     */
    public Optional<Receivable> findByIdForUpdate(String receivableId) {
        return jdbcTemplate.query(COLUMNS + "WHERE receivable_id = ? FOR UPDATE", receivableRowMapper(),
            receivableId).stream().findFirst();
    }

    public List<Receivable> findByOwner(String ownerId) {
        return jdbcTemplate.query(COLUMNS + "WHERE owner_id = ? ORDER BY created_at, receivable_id",
            receivableRowMapper(), ownerId);
    }

    public Receivable save(Receivable receivable) {
        int updated = jdbcTemplate.update(
            "UPDATE receivables SET paid_amount = ?, drawn_amount = ?, state = ?, updated_at = ? " +
            "WHERE receivable_id = ?",
            receivable.getPaidAmount(),
            receivable.getDrawnAmount(),
            receivable.getState().name(),
            Timestamp.from(receivable.getUpdatedAt()),
            receivable.getReceivableId()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO receivables (receivable_id, owner_id, amount, paid_amount, drawn_amount, " +
                "maturity_date, reference_id, state, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                receivable.getReceivableId(),
                receivable.getOwnerId(),
                receivable.getAmount(),
                receivable.getPaidAmount(),
                receivable.getDrawnAmount(),
                Date.valueOf(receivable.getMaturityDate()),
                receivable.getReferenceId(),
                receivable.getState().name(),
                Timestamp.from(receivable.getCreatedAt()),
                Timestamp.from(receivable.getUpdatedAt())
            );
        }
        return receivable;
    }

    private RowMapper<Receivable> receivableRowMapper() {
        return (rs, rowNum) -> Receivable.builder()
            .receivableId(rs.getString("receivable_id"))
            .ownerId(rs.getString("owner_id"))
            .amount(Amounts.scale(rs.getBigDecimal("amount")))
            .paidAmount(Amounts.scale(rs.getBigDecimal("paid_amount")))
            .drawnAmount(Amounts.scale(rs.getBigDecimal("drawn_amount")))
            .maturityDate(rs.getDate("maturity_date").toLocalDate())
            .referenceId(rs.getString("reference_id"))
            .state(ReceivableState.valueOf(rs.getString("state")))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
