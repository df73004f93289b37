package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * The pool_state row of a pool. {@link #lock(String)} takes the row lock that
 * serializes every change to pool accounting.
 */
@Repository
public class PoolStateRepository {

    private static final String SELECT_COLUMNS =
        "SELECT senior_assets, junior_assets, senior_losses, junior_losses, total_pool_value, shortfall, enabled " +
        "FROM pool_state WHERE pool_name = ?";

    private final JdbcTemplate jdbcTemplate;

    public PoolStateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<PoolState> find(String poolName) {
        return jdbcTemplate.query(SELECT_COLUMNS, poolStateRowMapper(), poolName).stream().findFirst();
    }

    /**
     * Reads the state with a row lock held until the surrounding transaction ends.
     */
    public PoolState lock(String poolName) {
        return jdbcTemplate.query(SELECT_COLUMNS + " FOR UPDATE", poolStateRowMapper(), poolName).stream()
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Pool " + poolName + " is not initialized"));
    }

    /**
     * Inserts an empty, enabled state unless the pool already has one.
     */
    public void initialize(String poolName) {
        if (find(poolName).isPresent()) {
            return;
        }
        jdbcTemplate.update(
            "INSERT INTO pool_state (pool_name, senior_assets, junior_assets, senior_losses, junior_losses, " +
            "total_pool_value, shortfall, enabled, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            poolName, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, true
        );
    }

    public PoolState save(String poolName, PoolState state) {
        jdbcTemplate.update(
            "UPDATE pool_state SET senior_assets = ?, junior_assets = ?, senior_losses = ?, junior_losses = ?, " +
            "total_pool_value = ?, shortfall = ?, enabled = ?, updated_at = CURRENT_TIMESTAMP WHERE pool_name = ?",
            state.getAssets().getSenior(),
            state.getAssets().getJunior(),
            state.getLosses().getSenior(),
            state.getLosses().getJunior(),
            state.getTotalPoolValue(),
            state.getShortfall(),
            state.isEnabled(),
            poolName
        );
        return state;
    }

    private RowMapper<PoolState> poolStateRowMapper() {
        return (rs, rowNum) -> PoolState.builder()
            .assets(TrancheAssets.of(rs.getBigDecimal("senior_assets"), rs.getBigDecimal("junior_assets")))
            .losses(TrancheAssets.of(rs.getBigDecimal("senior_losses"), rs.getBigDecimal("junior_losses")))
            .totalPoolValue(Amounts.scale(rs.getBigDecimal("total_pool_value")))
            .shortfall(Amounts.scale(rs.getBigDecimal("shortfall")))
            .enabled(rs.getBoolean("enabled"))
            .build();
    }
}
