package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.liquidity.Tranche;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Share book of the tranche vaults: supply and escrow per tranche, lender
 * balances, lender redemption records and the per-epoch redemption summaries.
 */
@Repository
public class TrancheVaultRepository {

    private static final String SUMMARY_COLUMNS =
        "SELECT epoch_id, total_shares_requested, total_shares_processed, total_amount_processed, sealed " +
        "FROM epoch_redemption_summaries ";

    private final JdbcTemplate jdbcTemplate;

    public TrancheVaultRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the vault row and the first open summary unless the tranche already has them.
     */
    public void initialize(Tranche tranche, long firstEpochId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM tranche_vaults WHERE tranche = ?", Integer.class, tranche.name());
        if (count != null && count > 0) {
            return;
        }
        jdbcTemplate.update(
            "INSERT INTO tranche_vaults (tranche, total_supply, escrowed_shares) VALUES (?, ?, ?)",
            tranche.name(), Amounts.ZERO, Amounts.ZERO
        );
        saveSummary(tranche, EpochRedemptionSummary.open(firstEpochId, Amounts.ZERO));
    }

    // ==================== Supply ====================

    public VaultTotals findTotals(Tranche tranche) {
        return jdbcTemplate.queryForObject(
            "SELECT total_supply, escrowed_shares FROM tranche_vaults WHERE tranche = ?",
            vaultTotalsRowMapper(),
            tranche.name()
        );
    }

    /**
     * Reads supply and escrow with the vault row locked until the transaction ends.
     */
    public VaultTotals lockTotals(Tranche tranche) {
        return jdbcTemplate.queryForObject(
            "SELECT total_supply, escrowed_shares FROM tranche_vaults WHERE tranche = ? FOR UPDATE",
            vaultTotalsRowMapper(),
            tranche.name()
        );
    }

    public void saveTotals(Tranche tranche, VaultTotals totals) {
        jdbcTemplate.update(
            "UPDATE tranche_vaults SET total_supply = ?, escrowed_shares = ? WHERE tranche = ?",
            totals.getTotalSupply(), totals.getEscrowedShares(), tranche.name()
        );
    }

    // ==================== Lenders ====================

    public void approveLender(Tranche tranche, String lenderId) {
        int updated = jdbcTemplate.update(
            "UPDATE vault_lenders SET approved = TRUE WHERE tranche = ? AND lender_id = ?",
            tranche.name(), lenderId);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO vault_lenders (tranche, lender_id, approved, share_balance) VALUES (?, ?, TRUE, ?)",
                tranche.name(), lenderId, Amounts.ZERO);
        }
    }

    public void revokeLender(Tranche tranche, String lenderId) {
        jdbcTemplate.update(
            "UPDATE vault_lenders SET approved = FALSE WHERE tranche = ? AND lender_id = ?",
            tranche.name(), lenderId);
    }

    public boolean isApproved(Tranche tranche, String lenderId) {
        List<Boolean> approved = jdbcTemplate.queryForList(
            "SELECT approved FROM vault_lenders WHERE tranche = ? AND lender_id = ?",
            Boolean.class, tranche.name(), lenderId);
        return !approved.isEmpty() && Boolean.TRUE.equals(approved.get(0));
    }

    public BigDecimal getShareBalance(Tranche tranche, String lenderId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT share_balance FROM vault_lenders WHERE tranche = ? AND lender_id = ?",
            BigDecimal.class, tranche.name(), lenderId);
        return balances.isEmpty() ? Amounts.ZERO : Amounts.scale(balances.get(0));
    }

    /**
     * Sets the balance, adding a (not approved) lender row for holders that were never approved.
     */
    public void saveShareBalance(Tranche tranche, String lenderId, BigDecimal balance) {
        int updated = jdbcTemplate.update(
            "UPDATE vault_lenders SET share_balance = ? WHERE tranche = ? AND lender_id = ?",
            balance, tranche.name(), lenderId);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO vault_lenders (tranche, lender_id, approved, share_balance) VALUES (?, ?, FALSE, ?)",
                tranche.name(), lenderId, balance);
        }
    }

    public BigDecimal sumShareBalances(Tranche tranche) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(share_balance), 0) FROM vault_lenders WHERE tranche = ?",
            BigDecimal.class, tranche.name());
        return sum != null ? Amounts.scale(sum) : Amounts.ZERO;
    }

    // ==================== Redemption records ====================

    public Optional<LenderRedemptionRecord> findRecord(Tranche tranche, String lenderId) {
        return jdbcTemplate.query(
            "SELECT last_updated_epoch_id, shares_requested, total_shares_processed, total_amount_processed, " +
            "total_amount_withdrawn FROM lender_redemption_records WHERE tranche = ? AND lender_id = ?",
            (rs, rowNum) -> LenderRedemptionRecord.builder()
                .lastUpdatedEpochId(rs.getLong("last_updated_epoch_id"))
                .sharesRequested(Amounts.scale(rs.getBigDecimal("shares_requested")))
                .totalSharesProcessed(Amounts.scale(rs.getBigDecimal("total_shares_processed")))
                .totalAmountProcessed(Amounts.scale(rs.getBigDecimal("total_amount_processed")))
                .totalAmountWithdrawn(Amounts.scale(rs.getBigDecimal("total_amount_withdrawn")))
                .build(),
            tranche.name(),
            lenderId
        ).stream().findFirst();
    }

    public void saveRecord(Tranche tranche, String lenderId, LenderRedemptionRecord record) {
        int updated = jdbcTemplate.update(
            "UPDATE lender_redemption_records SET last_updated_epoch_id = ?, shares_requested = ?, " +
            "total_shares_processed = ?, total_amount_processed = ?, total_amount_withdrawn = ? " +
            "WHERE tranche = ? AND lender_id = ?",
            record.getLastUpdatedEpochId(),
            record.getSharesRequested(),
            record.getTotalSharesProcessed(),
            record.getTotalAmountProcessed(),
            record.getTotalAmountWithdrawn(),
            tranche.name(),
            lenderId
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO lender_redemption_records (tranche, lender_id, last_updated_epoch_id, " +
                "shares_requested, total_shares_processed, total_amount_processed, total_amount_withdrawn) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                tranche.name(),
                lenderId,
                record.getLastUpdatedEpochId(),
                record.getSharesRequested(),
                record.getTotalSharesProcessed(),
                record.getTotalAmountProcessed(),
                record.getTotalAmountWithdrawn()
            );
        }
    }

    // ==================== Summaries ====================

    public EpochRedemptionSummary findOpenSummary(Tranche tranche) {
        return jdbcTemplate.queryForObject(
            SUMMARY_COLUMNS + "WHERE tranche = ? AND sealed = FALSE",
            summaryRowMapper(),
            tranche.name()
        );
    }

    public Optional<EpochRedemptionSummary> findSummary(Tranche tranche, long epochId) {
        return jdbcTemplate.query(
            SUMMARY_COLUMNS + "WHERE tranche = ? AND epoch_id = ?",
            summaryRowMapper(),
            tranche.name(),
            epochId
        ).stream().findFirst();
    }

    public void saveSummary(Tranche tranche, EpochRedemptionSummary summary) {
        int updated = jdbcTemplate.update(
            "UPDATE epoch_redemption_summaries SET total_shares_requested = ?, total_shares_processed = ?, " +
            "total_amount_processed = ?, sealed = ? WHERE tranche = ? AND epoch_id = ?",
            summary.getTotalSharesRequested(),
            summary.getTotalSharesProcessed(),
            summary.getTotalAmountProcessed(),
            summary.isSealed(),
            tranche.name(),
            summary.getEpochId()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO epoch_redemption_summaries (tranche, epoch_id, total_shares_requested, " +
                "total_shares_processed, total_amount_processed, sealed) VALUES (?, ?, ?, ?, ?, ?)",
                tranche.name(),
                summary.getEpochId(),
                summary.getTotalSharesRequested(),
                summary.getTotalSharesProcessed(),
                summary.getTotalAmountProcessed(),
                summary.isSealed()
            );
        }
    }

    private RowMapper<VaultTotals> vaultTotalsRowMapper() {
        return (rs, rowNum) -> new VaultTotals(
            Amounts.scale(rs.getBigDecimal("total_supply")),
            Amounts.scale(rs.getBigDecimal("escrowed_shares")));
    }

    private RowMapper<EpochRedemptionSummary> summaryRowMapper() {
        return (rs, rowNum) -> new EpochRedemptionSummary(
            rs.getLong("epoch_id"),
            Amounts.scale(rs.getBigDecimal("total_shares_requested")),
            Amounts.scale(rs.getBigDecimal("total_shares_processed")),
            Amounts.scale(rs.getBigDecimal("total_amount_processed")),
            rs.getBoolean("sealed"));
    }
}
