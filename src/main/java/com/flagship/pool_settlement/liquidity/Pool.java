package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.event.EventJournal;
import com.flagship.pool_settlement.event.LossDistributedEvent;
import com.flagship.pool_settlement.event.LossRecoveredEvent;
import com.flagship.pool_settlement.event.PoolStatusChangedEvent;
import com.flagship.pool_settlement.event.ProfitDistributedEvent;
import com.flagship.pool_settlement.exception.LiquidityCapExceededException;
import com.flagship.pool_settlement.exception.PoolDisabledException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.observability.PoolMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pool accounting: the single owner of tranche assets, tranche losses and the
 * total pool value.
 *
 * Every operation keeps totalPoolValue equal to seniorAssets + juniorAssets +
 * the sum of cover assets, and fails (rolling back) if it would not. Changes
 * start by locking the pool_state row, which serializes them.
 *
 * Waterfall order:
 * - profit: pool fees, cover incentive shares, then the tranches policy split
 * - loss: covers by ascending rank, junior, senior, then shortfall
 * - recovery: senior, junior, covers by descending rank, leftover as profit
 */
@Slf4j
@Service
public class Pool {

    private final PoolProperties properties;
    private final FirstLossCovers firstLossCovers;
    private final PoolFeeManager poolFeeManager;
    private final TranchesPolicy tranchesPolicy;
    private final LedgerService ledgerService;
    private final PoolStateRepository stateRepository;
    private final TransactionTemplate transactionTemplate;
    private final EventJournal eventJournal;
    private final PoolMetrics metrics;
    private final Clock clock;
    private final String poolName;

    public Pool(PoolProperties properties,
                FirstLossCovers firstLossCovers,
                PoolFeeManager poolFeeManager,
                TranchesPolicy tranchesPolicy,
                LedgerService ledgerService,
                PoolStateRepository stateRepository,
                TransactionTemplate transactionTemplate,
                EventJournal eventJournal,
                PoolMetrics metrics,
                Clock clock) {
        this.properties = properties;
        this.firstLossCovers = firstLossCovers;
        this.poolFeeManager = poolFeeManager;
        this.tranchesPolicy = tranchesPolicy;
        this.ledgerService = ledgerService;
        this.stateRepository = stateRepository;
        this.transactionTemplate = transactionTemplate;
        this.eventJournal = eventJournal;
        this.metrics = metrics;
        this.clock = clock;
        this.poolName = properties.getName();

        transactionTemplate.executeWithoutResult(status -> {
            stateRepository.initialize(poolName);
            ledgerService.openAccount(CustodyAccounts.POOL_SAFE, Account.AccountType.INTERNAL);
        });

        metrics.registerPoolValueGauge(this::totalPoolValue);
        for (Tranche tranche : Tranche.values()) {
            metrics.registerTrancheAssetsGauge(tranche.id(), () -> trancheAssets(tranche));
        }
    }

    // ==================== Waterfall ====================

    public ProfitDistribution distributeProfit(BigDecimal profit) {
        BigDecimal amount = Amounts.requireNonNegative(profit, "profit");
        return transactionTemplate.execute(status -> {
            PoolState current = lockState();
            requireEnabled(current);
            if (amount.signum() == 0) {
                return ProfitDistribution.none();
            }
            LocalDate today = today();

            PoolFeeDistribution fees = poolFeeManager.distributePoolFees(amount);

            Map<String, BigDecimal> coverShares = tranchesPolicy.distProfitToFirstLossCovers(
                fees.getNetProfit(), current.getAssets(), firstLossCovers.inAbsorptionOrder());
            Map<String, BigDecimal> coverProfit = new LinkedHashMap<>();
            BigDecimal coverTotal = Amounts.ZERO;
            for (Map.Entry<String, BigDecimal> share : coverShares.entrySet()) {
                FirstLossCover cover = firstLossCovers.get(share.getKey());
                BigDecimal accepted = cover.addProfit(share.getValue());
                if (accepted.signum() > 0) {
                    ledgerService.transfer(CustodyAccounts.POOL_SAFE, cover.getAccountName(), accepted,
                        "Cover profit share");
                    coverProfit.put(cover.getCoverId(), accepted);
                    coverTotal = coverTotal.add(accepted);
                }
            }

            BigDecimal trancheTotal = fees.getNetProfit().subtract(coverTotal);
            TrancheAssets trancheProfit = tranchesPolicy.distProfitToTranches(
                trancheTotal, current.getAssets(), today);

            stateRepository.save(poolName, current.toBuilder()
                .assets(current.getAssets().plus(trancheProfit))
                .totalPoolValue(current.getTotalPoolValue().add(coverTotal).add(trancheTotal))
                .build());
            assertValueInvariant();

            eventJournal.record(ProfitDistributedEvent.of(properties.getName(), amount, fees.totalFees(),
                coverProfit, trancheProfit.getSenior(), trancheProfit.getJunior(), clock.instant()));
            metrics.recordProfitDistributed(amount);
            log.info("Distributed profit {}: fees={}, covers={}, senior={}, junior={}", amount,
                fees.totalFees(), coverTotal, trancheProfit.getSenior(), trancheProfit.getJunior());

            return new ProfitDistribution(amount, fees, coverProfit, trancheProfit);
        });
    }

    public LossDistribution distributeLoss(BigDecimal loss) {
        BigDecimal amount = Amounts.requireNonNegative(loss, "loss");
        return transactionTemplate.execute(status -> {
            PoolState current = lockState();
            requireEnabled(current);
            if (amount.signum() == 0) {
                return LossDistribution.none();
            }
            tranchesPolicy.refreshYieldTracker(current.getAssets(), today());

            BigDecimal remaining = amount;
            Map<String, BigDecimal> coverLoss = new LinkedHashMap<>();
            BigDecimal coverTotal = Amounts.ZERO;
            for (FirstLossCover cover : firstLossCovers.inAbsorptionOrder()) {
                if (remaining.signum() == 0) {
                    break;
                }
                BigDecimal covered = cover.coverLoss(remaining);
                if (covered.signum() > 0) {
                    ledgerService.transfer(cover.getAccountName(), CustodyAccounts.POOL_SAFE, covered,
                        "Cover absorbed loss");
                    coverLoss.put(cover.getCoverId(), covered);
                    coverTotal = coverTotal.add(covered);
                    remaining = remaining.subtract(covered);
                }
            }

            TrancheAssets trancheLoss = tranchesPolicy.distLossToTranches(remaining, current.getAssets());
            BigDecimal shortfall = remaining.subtract(trancheLoss.total());

            stateRepository.save(poolName, current.toBuilder()
                .assets(current.getAssets().minus(trancheLoss))
                .losses(current.getLosses().plus(trancheLoss))
                .totalPoolValue(current.getTotalPoolValue().subtract(coverTotal).subtract(trancheLoss.total()))
                .shortfall(current.getShortfall().add(shortfall))
                .build());
            assertValueInvariant();

            eventJournal.record(LossDistributedEvent.of(properties.getName(), amount, coverLoss,
                trancheLoss.getJunior(), trancheLoss.getSenior(), shortfall, clock.instant()));
            metrics.recordLossDistributed(amount);
            if (shortfall.signum() > 0) {
                metrics.recordShortfall(shortfall);
                log.warn("Loss {} exceeded covers and tranches, shortfall {}", amount, shortfall);
            }
            log.info("Distributed loss {}: covers={}, junior={}, senior={}", amount, coverTotal,
                trancheLoss.getJunior(), trancheLoss.getSenior());

            return new LossDistribution(amount, coverLoss, trancheLoss, shortfall);
        });
    }

    public LossRecoveryDistribution distributeLossRecovery(BigDecimal recovery) {
        BigDecimal amount = Amounts.requireNonNegative(recovery, "recovery");
        return transactionTemplate.execute(status -> {
            PoolState current = lockState();
            requireEnabled(current);
            if (amount.signum() == 0) {
                return LossRecoveryDistribution.none();
            }
            tranchesPolicy.refreshYieldTracker(current.getAssets(), today());

            TrancheAssets trancheRecovered = tranchesPolicy.distLossRecoveryToTranches(amount, current.getLosses());
            BigDecimal remaining = amount.subtract(trancheRecovered.total());

            Map<String, BigDecimal> coverRecovered = new LinkedHashMap<>();
            BigDecimal coverTotal = Amounts.ZERO;
            for (FirstLossCover cover : firstLossCovers.inRecoveryOrder()) {
                if (remaining.signum() == 0) {
                    break;
                }
                BigDecimal recovered = cover.recoverLoss(remaining);
                if (recovered.signum() > 0) {
                    ledgerService.transfer(CustodyAccounts.POOL_SAFE, cover.getAccountName(), recovered,
                        "Cover loss recovery");
                    coverRecovered.put(cover.getCoverId(), recovered);
                    coverTotal = coverTotal.add(recovered);
                    remaining = remaining.subtract(recovered);
                }
            }

            stateRepository.save(poolName, current.toBuilder()
                .assets(current.getAssets().plus(trancheRecovered))
                .losses(current.getLosses().minus(trancheRecovered))
                .totalPoolValue(current.getTotalPoolValue().add(trancheRecovered.total()).add(coverTotal))
                .build());
            assertValueInvariant();

            eventJournal.record(LossRecoveredEvent.of(properties.getName(), amount, trancheRecovered.getSenior(),
                trancheRecovered.getJunior(), coverRecovered, remaining, clock.instant()));
            metrics.recordLossRecovered(amount.subtract(remaining));
            log.info("Recovered {}: senior={}, junior={}, covers={}, leftover={}", amount,
                trancheRecovered.getSenior(), trancheRecovered.getJunior(), coverTotal, remaining);

            ProfitDistribution leftoverDistribution = remaining.signum() > 0
                ? distributeProfit(remaining)
                : ProfitDistribution.none();

            return new LossRecoveryDistribution(amount, trancheRecovered, coverRecovered, remaining,
                leftoverDistribution);
        });
    }

    // ==================== Liquidity movements ====================

    /**
     * Books a lender deposit into a tranche. The custody transfer is made by the vault.
     *
     * @throws LiquidityCapExceededException if the pool cap or the senior/junior ratio would be breached
     */
    public void recordDeposit(Tranche tranche, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        transactionTemplate.executeWithoutResult(status -> {
            PoolState current = lockState();
            requireEnabled(current);
            tranchesPolicy.refreshYieldTracker(current.getAssets(), today());
            TrancheAssets assets = current.getAssets();

            if (assets.total().add(value).compareTo(properties.getLiquidityCap()) > 0) {
                throw new LiquidityCapExceededException(String.format(
                    "Deposit of %s exceeds pool liquidity cap %s", value, properties.getLiquidityCap()));
            }
            int ratio = properties.getMaxSeniorJuniorRatio();
            if (tranche == Tranche.SENIOR && ratio > 0) {
                BigDecimal maxSenior = assets.getJunior().multiply(BigDecimal.valueOf(ratio));
                if (assets.getSenior().add(value).compareTo(maxSenior) > 0) {
                    throw new LiquidityCapExceededException(String.format(
                        "Senior assets may not exceed %d x junior assets (%s)", ratio, assets.getJunior()));
                }
            }

            stateRepository.save(poolName, current.toBuilder()
                .assets(assets.with(tranche, assets.get(tranche).add(value)))
                .totalPoolValue(current.getTotalPoolValue().add(value))
                .build());
            assertValueInvariant();
        });
    }

    /**
     * Removes redeemed assets from a tranche. The custody transfer to the
     * redemption reserve is made by the epoch manager.
     */
    public void recordRedemption(Tranche tranche, BigDecimal amount) {
        BigDecimal value = Amounts.requireNonNegative(amount, "amount");
        transactionTemplate.executeWithoutResult(status -> {
            if (value.signum() == 0) {
                return;
            }
            PoolState current = lockState();
            tranchesPolicy.refreshYieldTracker(current.getAssets(), today());
            BigDecimal trancheAssets = current.getAssets().get(tranche);
            if (value.compareTo(trancheAssets) > 0) {
                throw new IllegalStateException(String.format(
                    "Redemption of %s exceeds %s tranche assets %s", value, tranche, trancheAssets));
            }

            stateRepository.save(poolName, current.toBuilder()
                .assets(current.getAssets().with(tranche, trancheAssets.subtract(value)))
                .totalPoolValue(current.getTotalPoolValue().subtract(value))
                .build());
            assertValueInvariant();
        });
    }

    /**
     * Funds a first-loss cover from a provider's external account.
     */
    public BigDecimal depositCover(String coverId, String providerId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        return transactionTemplate.execute(status -> {
            PoolState current = lockState();
            FirstLossCover cover = firstLossCovers.get(coverId);
            String provider = CustodyAccounts.coverProvider(providerId);
            ledgerService.openAccount(provider, Account.AccountType.EXTERNAL);

            cover.addCoverAssets(value);
            ledgerService.transfer(provider, cover.getAccountName(), value, "Cover deposit");
            stateRepository.save(poolName, current.toBuilder()
                .totalPoolValue(current.getTotalPoolValue().add(value))
                .build());
            assertValueInvariant();

            log.info("Cover {} funded with {} by {}, now {}", coverId, value, providerId, cover.getCoverAssets());
            return cover.getCoverAssets();
        });
    }

    public BigDecimal withdrawCover(String coverId, String providerId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        return transactionTemplate.execute(status -> {
            PoolState current = lockState();
            FirstLossCover cover = firstLossCovers.get(coverId);
            String provider = CustodyAccounts.coverProvider(providerId);
            ledgerService.openAccount(provider, Account.AccountType.EXTERNAL);

            cover.removeCoverAssets(value);
            ledgerService.transfer(cover.getAccountName(), provider, value, "Cover withdrawal");
            stateRepository.save(poolName, current.toBuilder()
                .totalPoolValue(current.getTotalPoolValue().subtract(value))
                .build());
            assertValueInvariant();

            log.info("Cover {} released {} to {}, now {}", coverId, value, providerId, cover.getCoverAssets());
            return cover.getCoverAssets();
        });
    }

    // ==================== Status ====================

    public void enablePool() {
        setEnabled(true);
    }

    public void disablePool() {
        setEnabled(false);
    }

    private void setEnabled(boolean enabled) {
        transactionTemplate.executeWithoutResult(status -> {
            PoolState current = lockState();
            if (current.isEnabled() == enabled) {
                return;
            }
            stateRepository.save(poolName, current.toBuilder().enabled(enabled).build());
            eventJournal.record(PoolStatusChangedEvent.of(properties.getName(), enabled, clock.instant()));
            log.info("Pool {} {}", properties.getName(), enabled ? "enabled" : "disabled");
        });
    }

    public boolean isEnabled() {
        return getState().isEnabled();
    }

    /**
     * @throws PoolDisabledException if the pool is off
     */
    public void requireEnabled() {
        requireEnabled(getState());
    }

    private void requireEnabled(PoolState current) {
        if (!current.isEnabled()) {
            throw new PoolDisabledException("Pool " + poolName + " is disabled");
        }
    }

    /**
     * Locks the pool row until the current transaction ends and returns the state as locked.
     * Operations that read tranche assets and then change them must call this first.
     *
     * @throws IllegalStateException if called outside a transaction
     */
    public PoolState lockState() {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("The pool can only be locked inside a transaction");
        }
        return stateRepository.lock(poolName);
    }

    // ==================== Queries ====================

    public PoolState getState() {
        return stateRepository.find(poolName)
            .orElseThrow(() -> new IllegalStateException("Pool " + poolName + " is not initialized"));
    }

    public TrancheAssets currentTranchesAssets() {
        return getState().getAssets();
    }

    public BigDecimal trancheAssets(Tranche tranche) {
        return getState().getAssets().get(tranche);
    }

    public TrancheAssets trancheLosses() {
        return getState().getLosses();
    }

    public BigDecimal totalPoolValue() {
        return getState().getTotalPoolValue();
    }

    public BigDecimal shortfall() {
        return getState().getShortfall();
    }

    /**
     * Liquidity available for drawdowns and redemptions.
     */
    public BigDecimal availableLiquidity() {
        return ledgerService.getAccountBalance(CustodyAccounts.POOL_SAFE);
    }

    public TranchesPolicy getTranchesPolicy() {
        return tranchesPolicy;
    }

    /**
     * @return true when totalPoolValue equals tranche assets plus cover assets
     */
    public boolean checkValueInvariant() {
        PoolState state = getState();
        BigDecimal expected = state.getAssets().total().add(firstLossCovers.totalCoverAssets());
        return expected.compareTo(state.getTotalPoolValue()) == 0;
    }

    private void assertValueInvariant() {
        if (!checkValueInvariant()) {
            PoolState state = getState();
            throw new IllegalStateException(String.format(
                "Pool value %s does not match tranche assets %s plus cover assets %s",
                state.getTotalPoolValue(), state.getAssets().total(), firstLossCovers.totalCoverAssets()));
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
