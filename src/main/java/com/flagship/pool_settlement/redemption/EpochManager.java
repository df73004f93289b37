package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.calendar.Calendar;
import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.event.EpochClosedEvent;
import com.flagship.pool_settlement.event.EventJournal;
import com.flagship.pool_settlement.exception.EpochInProgressException;
import com.flagship.pool_settlement.exception.ResourceNotFoundException;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.liquidity.Tranche;
import com.flagship.pool_settlement.liquidity.TrancheAssets;
import com.flagship.pool_settlement.observability.CorrelationContext;
import com.flagship.pool_settlement.observability.PoolMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Runs the redemption epochs.
 *
 * Closing an epoch prices both tranches, decides how many requested shares
 * the pool's free liquidity can buy back, moves that amount to each tranche's
 * redemption reserve and seals the vault summaries. Senior requests are served
 * first unless the pool is configured for pro rata settlement. Junior
 * redemptions never leave senior assets above the configured multiple of
 * junior assets.
 *
 * A close claims the epoch row (OPEN to SETTLING) before touching the pool,
 * so a second close of the same epoch fails instead of settling it twice.
 */
@Slf4j
@Service
public class EpochManager {

    private final Pool pool;
    private final TrancheVaults vaults;
    private final LedgerService ledgerService;
    private final EpochRepository epochRepository;
    private final TransactionTemplate transactionTemplate;
    private final EventJournal eventJournal;
    private final PoolMetrics metrics;
    private final PoolProperties properties;
    private final Clock clock;

    public EpochManager(Pool pool,
                        TrancheVaults vaults,
                        LedgerService ledgerService,
                        EpochRepository epochRepository,
                        TransactionTemplate transactionTemplate,
                        EventJournal eventJournal,
                        PoolMetrics metrics,
                        PoolProperties properties,
                        Clock clock) {
        this.pool = pool;
        this.vaults = vaults;
        this.ledgerService = ledgerService;
        this.epochRepository = epochRepository;
        this.transactionTemplate = transactionTemplate;
        this.eventJournal = eventJournal;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;

        transactionTemplate.executeWithoutResult(status -> {
            if (epochRepository.findOpen().isEmpty()) {
                LocalDate endDate = Calendar.startOfNextPeriod(properties.getPayPeriodDuration(), LocalDate.now(clock));
                epochRepository.insertOpen(new Epoch(TrancheVaults.FIRST_EPOCH_ID, endDate));
            }
        });
    }

    public Epoch currentEpoch() {
        return epochRepository.findOpen()
            .orElseThrow(() -> new EpochInProgressException("The current epoch is being settled"));
    }

    public EpochRedemptionSummary redemptionSummary(Tranche tranche, long epochId) {
        return vaults.get(tranche).findSummary(epochId)
            .orElseThrow(() -> new ResourceNotFoundException(String.format(
                "No %s redemption summary for epoch %d", tranche.id(), epochId)));
    }

    /**
     * Settles the current epoch and opens the next one.
     *
     * @throws EpochInProgressException if the epoch has not reached its end date or is already settling
     */
    public EpochCloseResult closeEpoch() {
        Epoch epoch = currentEpoch();
        try (CorrelationContext.MdcScope ignored =
                 CorrelationContext.scoped(CorrelationContext.EPOCH_ID_MDC_KEY, epoch.getId())) {
            return metrics.timeEpochClose(() -> transactionTemplate.execute(status -> {
                LocalDate today = LocalDate.now(clock);
                if (!epoch.hasEnded(today)) {
                    throw new EpochInProgressException(String.format(
                        "Epoch %d runs until %s", epoch.getId(), epoch.getEndDate()));
                }
                if (!epochRepository.claimForSettlement(epoch.getId())) {
                    throw new EpochInProgressException("Epoch " + epoch.getId() + " is already being settled");
                }
                pool.lockState();
                pool.requireEnabled();

                EpochCloseResult result = settle(epoch, today);
                epochRepository.markClosed(epoch.getId(), clock.instant());
                epochRepository.insertOpen(result.getNextEpoch());
                return result;
            }));
        }
    }

    private EpochCloseResult settle(Epoch epoch, LocalDate today) {
        TrancheVault senior = vaults.senior();
        TrancheVault junior = vaults.junior();
        TrancheAssets assets = pool.currentTranchesAssets();
        BigDecimal liquidity = pool.availableLiquidity();

        BigDecimal seniorRequested = senior.getOpenSummary().getTotalSharesRequested();
        BigDecimal juniorRequested = junior.getOpenSummary().getTotalSharesRequested();
        BigDecimal seniorPrice = senior.pricePerShare();
        BigDecimal juniorPrice = junior.pricePerShare();

        BigDecimal seniorBudget;
        BigDecimal juniorBudget;
        if (properties.getRedemption().getPriority() == RedemptionPriority.PRO_RATA) {
            BigDecimal seniorWanted = valueOf(seniorRequested, seniorPrice);
            BigDecimal juniorWanted = valueOf(juniorRequested, juniorPrice);
            BigDecimal totalWanted = seniorWanted.add(juniorWanted);
            if (totalWanted.compareTo(liquidity) <= 0) {
                seniorBudget = seniorWanted;
                juniorBudget = juniorWanted;
            } else {
                seniorBudget = Amounts.mulDiv(liquidity, seniorWanted, totalWanted);
                juniorBudget = liquidity.subtract(seniorBudget);
            }
        } else {
            seniorBudget = liquidity;
            juniorBudget = null;
        }

        Redemption seniorRedemption = redeem(seniorRequested, seniorPrice,
            Amounts.min(seniorBudget, assets.getSenior()));
        if (juniorBudget == null) {
            juniorBudget = liquidity.subtract(seniorRedemption.amount);
        }
        BigDecimal juniorCap = Amounts.min(juniorBudget, juniorRedeemable(assets, seniorRedemption.amount));
        Redemption juniorRedemption = redeem(juniorRequested, juniorPrice, juniorCap);

        EpochRedemptionSummary seniorSummary = execute(senior, epoch, seniorRedemption);
        EpochRedemptionSummary juniorSummary = execute(junior, epoch, juniorRedemption);

        Epoch next = new Epoch(epoch.getId() + 1,
            Calendar.startOfNextPeriod(properties.getPayPeriodDuration(), today));

        eventJournal.record(EpochClosedEvent.of(epoch.getId(), seniorRedemption.shares, seniorRedemption.amount,
            juniorRedemption.shares, juniorRedemption.amount, next.getId(), next.getEndDate(), clock.instant()));
        log.info("Epoch {} closed: senior {} shares for {}, junior {} shares for {}; epoch {} ends {}",
            epoch.getId(), seniorRedemption.shares, seniorRedemption.amount, juniorRedemption.shares,
            juniorRedemption.amount, next.getId(), next.getEndDate());

        return new EpochCloseResult(epoch.getId(), seniorSummary, juniorSummary, next);
    }

    private EpochRedemptionSummary execute(TrancheVault vault, Epoch epoch, Redemption redemption) {
        if (redemption.amount.signum() > 0) {
            ledgerService.transfer(CustodyAccounts.POOL_SAFE, vault.getReserveAccount(), redemption.amount,
                "Epoch " + epoch.getId() + " " + vault.getTranche().id() + " redemption");
            pool.recordRedemption(vault.getTranche(), redemption.amount);
        }
        return vault.executeRedemption(epoch.getId(), redemption.shares, redemption.amount);
    }

    /**
     * Junior assets that can leave the tranche while senior stays within the ratio.
     */
    private BigDecimal juniorRedeemable(TrancheAssets assets, BigDecimal seniorRedeemed) {
        int ratio = properties.getMaxSeniorJuniorRatio();
        if (ratio <= 0) {
            return assets.getJunior();
        }
        BigDecimal seniorAfter = assets.getSenior().subtract(seniorRedeemed);
        BigDecimal minJunior = seniorAfter.divide(BigDecimal.valueOf(ratio), Amounts.SCALE, RoundingMode.CEILING);
        return Amounts.max(Amounts.ZERO, assets.getJunior().subtract(minJunior));
    }

    private static Redemption redeem(BigDecimal requestedShares, BigDecimal price, BigDecimal budget) {
        if (requestedShares.signum() == 0 || price.signum() == 0 || budget.signum() <= 0) {
            return Redemption.NONE;
        }
        BigDecimal wanted = valueOf(requestedShares, price);
        if (wanted.compareTo(budget) <= 0) {
            return new Redemption(requestedShares, wanted);
        }
        BigDecimal shares = budget.divide(price, Amounts.SCALE, RoundingMode.DOWN);
        return new Redemption(shares, valueOf(shares, price));
    }

    private static BigDecimal valueOf(BigDecimal shares, BigDecimal price) {
        return shares.multiply(price).setScale(Amounts.SCALE, RoundingMode.DOWN);
    }

    private static final class Redemption {
        static final Redemption NONE = new Redemption(Amounts.ZERO, Amounts.ZERO);

        final BigDecimal shares;
        final BigDecimal amount;

        Redemption(BigDecimal shares, BigDecimal amount) {
            this.shares = shares;
            this.amount = amount;
        }
    }
}
