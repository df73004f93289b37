package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.CoverCapExceededException;
import com.flagship.pool_settlement.exception.InsufficientLiquidityException;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A first-loss reserve that absorbs losses before either tranche.
 *
 * Each loss is covered up to min(loss * coverRate, coverCapPerLoss, coverAssets).
 * A coverCapPerLoss of zero means no per-loss cap. Cover assets never exceed
 * maxLiquidity. Mutated only by {@link Pool}, under the pool row lock.
 */
@Getter
public class FirstLossCover {

    private final String coverId;
    private final int rank;
    private final BigDecimal maxLiquidity;
    private final int coverRateBps;
    private final BigDecimal coverCapPerLoss;
    private final int riskYieldMultiplierBps;

    @Getter(lombok.AccessLevel.NONE)
    private final FirstLossCoverRepository repository;

    @Value
    static class CoverState {
        BigDecimal coverAssets;
        BigDecimal lossesAbsorbed;
    }

    public FirstLossCover(PoolProperties.FirstLossCover config, FirstLossCoverRepository repository) {
        this.coverId = config.getId();
        this.rank = config.getRank();
        this.maxLiquidity = Amounts.requireNonNegative(config.getMaxLiquidity(), "maxLiquidity");
        this.coverRateBps = config.getCoverRateBps();
        this.coverCapPerLoss = Amounts.requireNonNegative(config.getCoverCapPerLoss(), "coverCapPerLoss");
        this.riskYieldMultiplierBps = config.getRiskYieldMultiplierBps();
        this.repository = repository;
    }

    public String getAccountName() {
        return CustodyAccounts.cover(coverId);
    }

    public BigDecimal getCoverAssets() {
        return repository.find(coverId).getCoverAssets();
    }

    public BigDecimal getLossesAbsorbed() {
        return repository.find(coverId).getLossesAbsorbed();
    }

    public BigDecimal capacity() {
        return Amounts.max(Amounts.ZERO, maxLiquidity.subtract(getCoverAssets()));
    }

    /**
     * Cover assets weighted by the risk-yield multiplier, used for the cover's profit share.
     */
    public BigDecimal riskWeightedAssets() {
        return Amounts.bps(getCoverAssets(), riskYieldMultiplierBps);
    }

    public BigDecimal calcLossCover(BigDecimal loss) {
        BigDecimal covered = Amounts.min(Amounts.bps(loss, coverRateBps), getCoverAssets());
        if (coverCapPerLoss.signum() > 0) {
            covered = Amounts.min(covered, coverCapPerLoss);
        }
        return covered;
    }

    /**
     * @throws CoverCapExceededException if the deposit would exceed maxLiquidity
     */
    void addCoverAssets(BigDecimal amount) {
        BigDecimal newAssets = getCoverAssets().add(amount);
        if (newAssets.compareTo(maxLiquidity) > 0) {
            throw new CoverCapExceededException(String.format(
                "Cover %s holds %s of %s, cannot add %s", coverId, getCoverAssets(), maxLiquidity, amount));
        }
        repository.save(coverId, newAssets, getLossesAbsorbed());
    }

    void removeCoverAssets(BigDecimal amount) {
        if (amount.compareTo(getCoverAssets()) > 0) {
            throw new InsufficientLiquidityException(String.format(
                "Cover %s holds %s, cannot withdraw %s", coverId, getCoverAssets(), amount));
        }
        repository.save(coverId, getCoverAssets().subtract(amount), getLossesAbsorbed());
    }

    /**
     * Accepts as much of a profit share as fits under maxLiquidity.
     *
     * @return the part accepted; the rest goes back to the tranches
     */
    BigDecimal addProfit(BigDecimal share) {
        BigDecimal accepted = Amounts.min(share, capacity());
        if (accepted.signum() > 0) {
            repository.save(coverId, getCoverAssets().add(accepted), getLossesAbsorbed());
        }
        return accepted;
    }

    BigDecimal coverLoss(BigDecimal loss) {
        BigDecimal covered = calcLossCover(loss);
        if (covered.signum() > 0) {
            repository.save(coverId, getCoverAssets().subtract(covered), getLossesAbsorbed().add(covered));
        }
        return covered;
    }

    /**
     * Restores assets up to the losses this cover absorbed earlier.
     *
     * @return the part of the recovery kept by this cover
     */
    BigDecimal recoverLoss(BigDecimal recovery) {
        BigDecimal recovered = Amounts.min(recovery, getLossesAbsorbed());
        if (recovered.signum() > 0) {
            repository.save(coverId, getCoverAssets().add(recovered), getLossesAbsorbed().subtract(recovered));
        }
        return recovered;
    }
}
