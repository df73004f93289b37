package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Credit rows: the billing record, the approved terms and the available credit.
 */
@Repository
public class CreditRepository {

    private static final String RECORD_COLUMNS =
        "SELECT credit_id, borrower_id, credit_type, receivable_id, state, unbilled_principal, next_due_date, " +
        "maturity_date, next_due, yield_due, due_accrued, due_committed, due_paid, yield_past_due, " +
        "principal_past_due, late_fee, missed_periods, remaining_periods FROM credits ";

    private final JdbcTemplate jdbcTemplate;

    public CreditRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<CreditRecord> findById(String creditId) {
        return jdbcTemplate.query(RECORD_COLUMNS + "WHERE credit_id = ?", recordRowMapper(), creditId)
            .stream().findFirst();
    }

    /**
     * Reads the record with its row locked until the transaction ends.
     */
    public Optional<CreditRecord> findByIdForUpdate(String creditId) {
        return jdbcTemplate.query(RECORD_COLUMNS + "WHERE credit_id = ? FOR UPDATE", recordRowMapper(), creditId)
            .stream().findFirst();
    }

    /**
     * Inserts a newly approved credit, replacing a closed credit stored under the same id.
     */
    public CreditRecord create(CreditRecord record, CreditConfig config, BigDecimal availableCredit) {
        jdbcTemplate.update("DELETE FROM credits WHERE credit_id = ? AND state = ?",
            record.getCreditId(), CreditState.CLOSED.name());
        DueDetail due = record.getDueDetail();
        jdbcTemplate.update(
            "INSERT INTO credits (credit_id, borrower_id, credit_type, receivable_id, state, unbilled_principal, " +
            "next_due_date, maturity_date, next_due, yield_due, due_accrued, due_committed, due_paid, " +
            "yield_past_due, principal_past_due, late_fee, missed_periods, remaining_periods, available_credit, " +
            "credit_limit, committed_amount, yield_bps, num_of_periods, pay_period_duration, revolving) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            record.getCreditId(),
            record.getBorrowerId(),
            record.getCreditType().name(),
            record.getReceivableId(),
            record.getState().name(),
            record.getUnbilledPrincipal(),
            toDate(record.getNextDueDate()),
            toDate(record.getMaturityDate()),
            record.getNextDue(),
            record.getYieldDue(),
            due.getAccrued(),
            due.getCommitted(),
            due.getPaid(),
            due.getYieldPastDue(),
            due.getPrincipalPastDue(),
            due.getLateFee(),
            record.getMissedPeriods(),
            record.getRemainingPeriods(),
            availableCredit,
            config.getCreditLimit(),
            config.getCommittedAmount(),
            config.getYieldBps(),
            config.getNumOfPeriods(),
            config.getPayPeriodDuration().name(),
            config.isRevolving()
        );
        return record;
    }

    public CreditRecord save(CreditRecord record) {
        DueDetail due = record.getDueDetail();
        int updated = jdbcTemplate.update(
            "UPDATE credits SET state = ?, unbilled_principal = ?, next_due_date = ?, maturity_date = ?, " +
            "next_due = ?, yield_due = ?, due_accrued = ?, due_committed = ?, due_paid = ?, yield_past_due = ?, " +
            "principal_past_due = ?, late_fee = ?, missed_periods = ?, remaining_periods = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE credit_id = ?",
            record.getState().name(),
            record.getUnbilledPrincipal(),
            toDate(record.getNextDueDate()),
            toDate(record.getMaturityDate()),
            record.getNextDue(),
            record.getYieldDue(),
            due.getAccrued(),
            due.getCommitted(),
            due.getPaid(),
            due.getYieldPastDue(),
            due.getPrincipalPastDue(),
            due.getLateFee(),
            record.getMissedPeriods(),
            record.getRemainingPeriods(),
            record.getCreditId()
        );
        if (updated == 0) {
            throw new IllegalStateException("Credit not stored: " + record.getCreditId());
        }
        return record;
    }

    public Optional<CreditConfig> findConfig(String creditId) {
        return jdbcTemplate.query(
            "SELECT credit_limit, committed_amount, yield_bps, num_of_periods, pay_period_duration, revolving " +
            "FROM credits WHERE credit_id = ?",
            (rs, rowNum) -> CreditConfig.builder()
                .creditLimit(Amounts.scale(rs.getBigDecimal("credit_limit")))
                .committedAmount(Amounts.scale(rs.getBigDecimal("committed_amount")))
                .yieldBps(rs.getInt("yield_bps"))
                .numOfPeriods(rs.getInt("num_of_periods"))
                .payPeriodDuration(PayPeriodDuration.valueOf(rs.getString("pay_period_duration")))
                .revolving(rs.getBoolean("revolving"))
                .build(),
            creditId
        ).stream().findFirst();
    }

    public void saveConfig(String creditId, CreditConfig config) {
        jdbcTemplate.update(
            "UPDATE credits SET credit_limit = ?, committed_amount = ?, yield_bps = ?, num_of_periods = ?, " +
            "pay_period_duration = ?, revolving = ?, updated_at = CURRENT_TIMESTAMP WHERE credit_id = ?",
            config.getCreditLimit(),
            config.getCommittedAmount(),
            config.getYieldBps(),
            config.getNumOfPeriods(),
            config.getPayPeriodDuration().name(),
            config.isRevolving(),
            creditId
        );
    }

    public BigDecimal getAvailableCredit(String creditId) {
        List<BigDecimal> available = jdbcTemplate.queryForList(
            "SELECT available_credit FROM credits WHERE credit_id = ?", BigDecimal.class, creditId);
        return available.isEmpty() ? Amounts.ZERO : Amounts.scale(available.get(0));
    }

    public void setAvailableCredit(String creditId, BigDecimal amount) {
        jdbcTemplate.update(
            "UPDATE credits SET available_credit = ?, updated_at = CURRENT_TIMESTAMP WHERE credit_id = ?",
            amount, creditId);
    }

    public List<CreditRecord> findAll() {
        return jdbcTemplate.query(RECORD_COLUMNS + "ORDER BY created_at, credit_id", recordRowMapper());
    }

    public List<CreditRecord> findByBorrower(String borrowerId) {
        return jdbcTemplate.query(RECORD_COLUMNS + "WHERE borrower_id = ? ORDER BY created_at, credit_id",
            recordRowMapper(), borrowerId);
    }

    /**
     * Credits with a running billing schedule.
     */
    public List<String> findBillableIds() {
        return jdbcTemplate.queryForList(
            "SELECT credit_id FROM credits WHERE state IN (?, ?) ORDER BY credit_id",
            String.class, CreditState.GOOD_STANDING.name(), CreditState.DELAYED.name());
    }

    private RowMapper<CreditRecord> recordRowMapper() {
        return (rs, rowNum) -> CreditRecord.builder()
            .creditId(rs.getString("credit_id"))
            .borrowerId(rs.getString("borrower_id"))
            .creditType(CreditType.valueOf(rs.getString("credit_type")))
            .receivableId(rs.getString("receivable_id"))
            .state(CreditState.valueOf(rs.getString("state")))
            .unbilledPrincipal(Amounts.scale(rs.getBigDecimal("unbilled_principal")))
            .nextDueDate(toLocalDate(rs, "next_due_date"))
            .maturityDate(toLocalDate(rs, "maturity_date"))
            .nextDue(Amounts.scale(rs.getBigDecimal("next_due")))
            .yieldDue(Amounts.scale(rs.getBigDecimal("yield_due")))
            .dueDetail(DueDetail.builder()
                .accrued(Amounts.scale(rs.getBigDecimal("due_accrued")))
                .committed(Amounts.scale(rs.getBigDecimal("due_committed")))
                .paid(Amounts.scale(rs.getBigDecimal("due_paid")))
                .yieldPastDue(Amounts.scale(rs.getBigDecimal("yield_past_due")))
                .principalPastDue(Amounts.scale(rs.getBigDecimal("principal_past_due")))
                .lateFee(Amounts.scale(rs.getBigDecimal("late_fee")))
                .build())
            .missedPeriods(rs.getInt("missed_periods"))
            .remainingPeriods(rs.getInt("remaining_periods"))
            .build();
    }

    private static Date toDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDate toLocalDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date != null ? date.toLocalDate() : null;
    }
}
