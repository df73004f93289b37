package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cover assets and absorbed losses per first-loss cover. The cover terms stay in configuration.
 */
@Repository
public class FirstLossCoverRepository {

    private final JdbcTemplate jdbcTemplate;

    public FirstLossCoverRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize(String coverId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM first_loss_covers WHERE cover_id = ?", Integer.class, coverId);
        if (count == null || count == 0) {
            jdbcTemplate.update(
                "INSERT INTO first_loss_covers (cover_id, cover_assets, losses_absorbed, updated_at) " +
                "VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
                coverId, Amounts.ZERO, Amounts.ZERO
            );
        }
    }

    public FirstLossCover.CoverState find(String coverId) {
        List<FirstLossCover.CoverState> states = jdbcTemplate.query(
            "SELECT cover_assets, losses_absorbed FROM first_loss_covers WHERE cover_id = ?",
            (rs, rowNum) -> new FirstLossCover.CoverState(
                Amounts.scale(rs.getBigDecimal("cover_assets")),
                Amounts.scale(rs.getBigDecimal("losses_absorbed"))),
            coverId
        );
        if (states.isEmpty()) {
            throw new IllegalStateException("First loss cover " + coverId + " is not initialized");
        }
        return states.get(0);
    }

    public void save(String coverId, BigDecimal coverAssets, BigDecimal lossesAbsorbed) {
        jdbcTemplate.update(
            "UPDATE first_loss_covers SET cover_assets = ?, losses_absorbed = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE cover_id = ?",
            coverAssets, lossesAbsorbed, coverId
        );
    }
}
