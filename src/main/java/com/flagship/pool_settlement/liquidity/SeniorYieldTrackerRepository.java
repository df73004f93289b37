package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

/**
 * Accrued and unpaid senior yield of the fixed senior yield policy.
 */
@Repository
public class SeniorYieldTrackerRepository {

    private final JdbcTemplate jdbcTemplate;

    public SeniorYieldTrackerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public FixedSeniorYieldTranchesPolicy.SeniorYieldTracker find(String poolName) {
        List<FixedSeniorYieldTranchesPolicy.SeniorYieldTracker> trackers = jdbcTemplate.query(
            "SELECT total_accrued, unpaid_yield, last_updated_date FROM senior_yield_trackers WHERE pool_name = ?",
            (rs, rowNum) -> {
                Date lastUpdated = rs.getDate("last_updated_date");
                return new FixedSeniorYieldTranchesPolicy.SeniorYieldTracker(
                    Amounts.scale(rs.getBigDecimal("total_accrued")),
                    Amounts.scale(rs.getBigDecimal("unpaid_yield")),
                    lastUpdated != null ? lastUpdated.toLocalDate() : null);
            },
            poolName
        );
        return trackers.isEmpty()
            ? new FixedSeniorYieldTranchesPolicy.SeniorYieldTracker(Amounts.ZERO, Amounts.ZERO, null)
            : trackers.get(0);
    }

    public void save(String poolName, FixedSeniorYieldTranchesPolicy.SeniorYieldTracker tracker) {
        LocalDate lastUpdated = tracker.getLastUpdatedDate();
        Date date = lastUpdated != null ? Date.valueOf(lastUpdated) : null;
        int updated = jdbcTemplate.update(
            "UPDATE senior_yield_trackers SET total_accrued = ?, unpaid_yield = ?, last_updated_date = ? " +
            "WHERE pool_name = ?",
            tracker.getTotalAccrued(), tracker.getUnpaidYield(), date, poolName
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO senior_yield_trackers (pool_name, total_accrued, unpaid_yield, last_updated_date) " +
                "VALUES (?, ?, ?, ?)",
                poolName, tracker.getTotalAccrued(), tracker.getUnpaidYield(), date
            );
        }
    }
}
