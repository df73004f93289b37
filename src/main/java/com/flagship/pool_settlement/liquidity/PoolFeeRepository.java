package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Current fee schedule and the running total of fees accrued per recipient.
 */
@Repository
public class PoolFeeRepository {

    private final JdbcTemplate jdbcTemplate;

    public PoolFeeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Stores the configured schedule unless the pool already has one, which may have been updated since.
     */
    public void initialize(String poolName, FeeSchedule configured) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM fee_schedules WHERE pool_name = ?", Integer.class, poolName);
        if (count == null || count == 0) {
            jdbcTemplate.update(
                "INSERT INTO fee_schedules (pool_name, protocol_fee_bps, pool_owner_reward_bps, ea_reward_bps, " +
                "flat_fee, updated_at) VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                poolName,
                configured.getProtocolFeeBps(),
                configured.getPoolOwnerRewardBps(),
                configured.getEaRewardBps(),
                Amounts.scale(configured.getFlatFee())
            );
        }
    }

    public FeeSchedule findSchedule(String poolName) {
        return jdbcTemplate.queryForObject(
            "SELECT protocol_fee_bps, pool_owner_reward_bps, ea_reward_bps, flat_fee FROM fee_schedules " +
            "WHERE pool_name = ?",
            (rs, rowNum) -> FeeSchedule.builder()
                .protocolFeeBps(rs.getInt("protocol_fee_bps"))
                .poolOwnerRewardBps(rs.getInt("pool_owner_reward_bps"))
                .eaRewardBps(rs.getInt("ea_reward_bps"))
                .flatFee(Amounts.scale(rs.getBigDecimal("flat_fee")))
                .build(),
            poolName
        );
    }

    public void saveSchedule(String poolName, FeeSchedule schedule) {
        jdbcTemplate.update(
            "UPDATE fee_schedules SET protocol_fee_bps = ?, pool_owner_reward_bps = ?, ea_reward_bps = ?, " +
            "flat_fee = ?, updated_at = CURRENT_TIMESTAMP WHERE pool_name = ?",
            schedule.getProtocolFeeBps(),
            schedule.getPoolOwnerRewardBps(),
            schedule.getEaRewardBps(),
            Amounts.scale(schedule.getFlatFee()),
            poolName
        );
    }

    public BigDecimal getTotalAccrued(FeeRecipient recipient) {
        List<BigDecimal> totals = jdbcTemplate.queryForList(
            "SELECT total_accrued FROM fee_accruals WHERE recipient = ?", BigDecimal.class, recipient.name());
        return totals.isEmpty() ? Amounts.ZERO : Amounts.scale(totals.get(0));
    }

    public void addAccrued(FeeRecipient recipient, BigDecimal fee) {
        int updated = jdbcTemplate.update(
            "UPDATE fee_accruals SET total_accrued = total_accrued + ? WHERE recipient = ?", fee, recipient.name());
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO fee_accruals (recipient, total_accrued) VALUES (?, ?)", recipient.name(), fee);
        }
    }
}
