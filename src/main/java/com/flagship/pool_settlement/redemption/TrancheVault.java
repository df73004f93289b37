package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.event.EventJournal;
import com.flagship.pool_settlement.event.LenderActivityEvent;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.liquidity.Tranche;
import com.flagship.pool_settlement.observability.CorrelationContext;
import com.flagship.pool_settlement.observability.PoolMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Share ledger and redemption book of one tranche.
 *
 * Lender shares are either circulating (held by the lender) or escrowed
 * (pending redemption). Both count towards the supply used for pricing.
 * Redemption requests accumulate in the open epoch summary; the
 * {@link EpochManager} seals it and the lender collects the processed amount
 * through {@link #disburse(String)}.
 *
 * Every write locks the vault row first. Deposits lock the pool row before it.
 */
@Slf4j
public class TrancheVault {

    private final Tranche tranche;
    private final Pool pool;
    private final LedgerService ledgerService;
    private final TrancheVaultRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final EventJournal eventJournal;
    private final PoolMetrics metrics;
    private final Clock clock;
    private final String reserveAccount;

    public TrancheVault(Tranche tranche,
                        Pool pool,
                        LedgerService ledgerService,
                        TrancheVaultRepository repository,
                        TransactionTemplate transactionTemplate,
                        EventJournal eventJournal,
                        PoolMetrics metrics,
                        Clock clock,
                        long firstEpochId) {
        this.tranche = tranche;
        this.pool = pool;
        this.ledgerService = ledgerService;
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.eventJournal = eventJournal;
        this.metrics = metrics;
        this.clock = clock;
        this.reserveAccount = CustodyAccounts.redemptionReserve(tranche.id());

        transactionTemplate.executeWithoutResult(status -> {
            repository.initialize(tranche, firstEpochId);
            ledgerService.openAccount(reserveAccount, Account.AccountType.INTERNAL);
        });
    }

    public Tranche getTranche() {
        return tranche;
    }

    public String getReserveAccount() {
        return reserveAccount;
    }

    // ==================== Lenders ====================

    public void addApprovedLender(String lenderId) {
        transactionTemplate.executeWithoutResult(status -> {
            ledgerService.openAccount(CustodyAccounts.lender(lenderId), Account.AccountType.EXTERNAL);
            repository.approveLender(tranche, lenderId);
            log.info("Lender {} approved for {} tranche", lenderId, tranche.id());
        });
    }

    /**
     * Removes a lender from the approved list. Existing shares and redemption requests are kept.
     */
    public void removeApprovedLender(String lenderId) {
        transactionTemplate.executeWithoutResult(status -> {
            repository.revokeLender(tranche, lenderId);
            log.info("Lender {} removed from {} tranche", lenderId, tranche.id());
        });
    }

    public boolean isApprovedLender(String lenderId) {
        return repository.isApproved(tranche, lenderId);
    }

    // ==================== Deposits ====================

    /**
     * Deposits assets from the lender's account and mints shares at the current price.
     *
     * @return shares minted
     */
    public BigDecimal deposit(String lenderId, BigDecimal assets) {
        BigDecimal amount = Amounts.requirePositive(assets, "assets");
        try (CorrelationContext.MdcScope ignored = lenderScope(lenderId)) {
            return transactionTemplate.execute(status -> {
                requireApproved(lenderId);
                pool.lockState();
                pool.requireEnabled();
                VaultTotals totals = repository.lockTotals(tranche);
                BigDecimal shares = convertToShares(amount, totals.getTotalSupply());
                if (shares.signum() == 0) {
                    throw new IllegalArgumentException("Deposit of " + amount + " mints no shares");
                }

                pool.recordDeposit(tranche, amount);
                ledgerService.transfer(CustodyAccounts.lender(lenderId), CustodyAccounts.POOL_SAFE, amount,
                    "Deposit into " + tranche.id() + " tranche");
                repository.saveShareBalance(tranche, lenderId, balanceOf(lenderId).add(shares));
                repository.saveTotals(tranche, totals.withSupply(totals.getTotalSupply().add(shares)));

                eventJournal.record(LenderActivityEvent.of(tranche.id(), lenderId,
                    LenderActivityEvent.Activity.DEPOSIT, shares, amount, getCurrentEpochId(), clock.instant()));
                log.info("Deposit {} into {} tranche: {} shares minted", amount, tranche.id(), shares);
                return shares;
            });
        }
    }

    // ==================== Redemption ====================

    /**
     * Moves shares into escrow and adds them to the current epoch's requests.
     */
    public LenderRedemptionRecord addRedemptionRequest(String lenderId, BigDecimal shares) {
        BigDecimal value = Amounts.requirePositive(shares, "shares");
        try (CorrelationContext.MdcScope ignored = lenderScope(lenderId)) {
            return transactionTemplate.execute(status -> {
                pool.requireEnabled();
                VaultTotals totals = repository.lockTotals(tranche);
                BigDecimal balance = balanceOf(lenderId);
                if (value.compareTo(balance) > 0) {
                    throw new IllegalArgumentException(String.format(
                        "Redemption of %s shares exceeds balance %s", value, balance));
                }

                EpochRedemptionSummary open = repository.findOpenSummary(tranche);
                LenderRedemptionRecord record = settledRecord(lenderId, open.getEpochId()).withRequest(value);
                repository.saveRecord(tranche, lenderId, record);
                repository.saveShareBalance(tranche, lenderId, balance.subtract(value));
                repository.saveTotals(tranche, totals.withEscrow(totals.getEscrowedShares().add(value)));
                repository.saveSummary(tranche, open.withAdditionalRequest(value));

                eventJournal.record(LenderActivityEvent.of(tranche.id(), lenderId,
                    LenderActivityEvent.Activity.REDEMPTION_REQUESTED, value, null, open.getEpochId(),
                    clock.instant()));
                metrics.recordRedemptionRequested(tranche.id());
                log.info("Redemption of {} {} shares requested for epoch {}", value, tranche.id(), open.getEpochId());
                return record;
            });
        }
    }

    /**
     * Returns outstanding (not yet processed) shares from escrow to the lender.
     *
     * @throws IllegalArgumentException if the lender has fewer shares outstanding
     */
    public LenderRedemptionRecord cancelRedemptionRequest(String lenderId, BigDecimal shares) {
        BigDecimal value = Amounts.requirePositive(shares, "shares");
        try (CorrelationContext.MdcScope ignored = lenderScope(lenderId)) {
            return transactionTemplate.execute(status -> {
                VaultTotals totals = repository.lockTotals(tranche);
                EpochRedemptionSummary open = repository.findOpenSummary(tranche);
                LenderRedemptionRecord record = settledRecord(lenderId, open.getEpochId()).withCancellation(value);
                if (value.compareTo(totals.getEscrowedShares()) > 0) {
                    throw new IllegalStateException(String.format(
                        "Cancelling %s shares exceeds the %s escrowed in the %s tranche",
                        value, totals.getEscrowedShares(), tranche.id()));
                }

                repository.saveRecord(tranche, lenderId, record);
                repository.saveShareBalance(tranche, lenderId, balanceOf(lenderId).add(value));
                repository.saveTotals(tranche, totals.withEscrow(totals.getEscrowedShares().subtract(value)));
                repository.saveSummary(tranche, open.withCancelledRequest(value));

                eventJournal.record(LenderActivityEvent.of(tranche.id(), lenderId,
                    LenderActivityEvent.Activity.REDEMPTION_CANCELLED, value, null, open.getEpochId(),
                    clock.instant()));
                log.info("Redemption of {} {} shares cancelled", value, tranche.id());
                return record;
            });
        }
    }

    /**
     * Pays the lender everything processed and not yet withdrawn. Returns zero
     * (and moves nothing) when there is nothing to pay.
     */
    public BigDecimal disburse(String lenderId) {
        try (CorrelationContext.MdcScope ignored = lenderScope(lenderId)) {
            return transactionTemplate.execute(status -> {
                repository.lockTotals(tranche);
                long currentEpochId = getCurrentEpochId();
                Optional<LenderRedemptionRecord> stored = repository.findRecord(tranche, lenderId);
                LenderRedemptionRecord record = settledRecord(lenderId, currentEpochId);
                BigDecimal amount = Amounts.min(record.getWithdrawableAmount(),
                    ledgerService.getAccountBalance(reserveAccount));
                if (amount.signum() <= 0) {
                    if (stored.isPresent() && !stored.get().equals(record)) {
                        repository.saveRecord(tranche, lenderId, record);
                    }
                    return Amounts.ZERO;
                }

                ledgerService.transfer(reserveAccount, CustodyAccounts.lender(lenderId), amount,
                    "Redemption disbursement from " + tranche.id() + " tranche");
                repository.saveRecord(tranche, lenderId, record.withWithdrawal(amount));

                eventJournal.record(LenderActivityEvent.of(tranche.id(), lenderId,
                    LenderActivityEvent.Activity.DISBURSED, null, amount, currentEpochId, clock.instant()));
                metrics.recordRedemptionDisbursed(tranche.id(), amount);
                log.info("Disbursed {} from {} tranche reserve", amount, tranche.id());
                return amount;
            });
        }
    }

    /**
     * Seals the open summary and opens the next epoch with the unprocessed shares carried over.
     */
    EpochRedemptionSummary executeRedemption(long epochId, BigDecimal sharesProcessed, BigDecimal amountProcessed) {
        return transactionTemplate.execute(status -> {
            VaultTotals totals = repository.lockTotals(tranche);
            EpochRedemptionSummary open = repository.findOpenSummary(tranche);
            if (open.getEpochId() != epochId) {
                throw new IllegalStateException(String.format(
                    "%s tranche is at epoch %d, cannot settle epoch %d", tranche.id(), open.getEpochId(), epochId));
            }
            EpochRedemptionSummary sealed = open.seal(sharesProcessed, amountProcessed);
            repository.saveSummary(tranche, sealed);
            repository.saveTotals(tranche, new VaultTotals(
                totals.getTotalSupply().subtract(sealed.getTotalSharesProcessed()),
                totals.getEscrowedShares().subtract(sealed.getTotalSharesProcessed())));
            repository.saveSummary(tranche, EpochRedemptionSummary.open(epochId + 1, sealed.getUnprocessedShares()));

            log.debug("{} tranche epoch {} sealed: {}/{} shares for {}", tranche.id(), epochId,
                sealed.getTotalSharesProcessed(), sealed.getTotalSharesRequested(), sealed.getTotalAmountProcessed());
            return sealed;
        });
    }

    // ==================== Queries ====================

    public long getCurrentEpochId() {
        return repository.findOpenSummary(tranche).getEpochId();
    }

    public EpochRedemptionSummary getOpenSummary() {
        return repository.findOpenSummary(tranche);
    }

    public Optional<EpochRedemptionSummary> findSummary(long epochId) {
        return repository.findSummary(tranche, epochId);
    }

    /**
     * Redemption record with every sealed epoch applied. Does not modify the stored record.
     */
    public LenderRedemptionRecord redemptionRecord(String lenderId) {
        return settledRecord(lenderId, getCurrentEpochId());
    }

    public BigDecimal withdrawableAssets(String lenderId) {
        return redemptionRecord(lenderId).getWithdrawableAmount();
    }

    public BigDecimal totalSupply() {
        return repository.findTotals(tranche).getTotalSupply();
    }

    public BigDecimal escrowedShares() {
        return repository.findTotals(tranche).getEscrowedShares();
    }

    /**
     * Circulating shares held by the lender, excluding shares in escrow.
     */
    public BigDecimal balanceOf(String lenderId) {
        return repository.getShareBalance(tranche, lenderId);
    }

    public BigDecimal totalAssets() {
        return pool.trancheAssets(tranche);
    }

    /**
     * Assets per share at {@link Amounts#PRICE_SCALE}, 1 while no shares exist.
     */
    public BigDecimal pricePerShare() {
        BigDecimal supply = totalSupply();
        if (supply.signum() == 0) {
            return BigDecimal.ONE.setScale(Amounts.PRICE_SCALE);
        }
        return totalAssets().divide(supply, Amounts.PRICE_SCALE, RoundingMode.DOWN);
    }

    /**
     * Shares minted for a deposit of {@code assets}.
     *
     * While no shares exist the price is 1, whatever the tranche still holds.
     * Assets left behind after the last share was redeemed (late recoveries,
     * profit booked after a full exit) therefore go to the next depositor.
     */
    public BigDecimal convertToShares(BigDecimal assets) {
        return convertToShares(assets, totalSupply());
    }

    private BigDecimal convertToShares(BigDecimal assets, BigDecimal supply) {
        BigDecimal trancheAssets = totalAssets();
        if (supply.signum() == 0) {
            if (trancheAssets.signum() > 0) {
                log.warn("{} tranche holds {} with no shares outstanding; the next depositor receives it",
                    tranche.id(), trancheAssets);
            }
            return Amounts.scale(assets);
        }
        if (trancheAssets.signum() == 0) {
            throw new IllegalStateException(tranche.id() + " tranche has shares outstanding but no assets");
        }
        return Amounts.mulDiv(assets, supply, trancheAssets);
    }

    public BigDecimal convertToAssets(BigDecimal shares) {
        BigDecimal supply = totalSupply();
        if (supply.signum() == 0) {
            return Amounts.scale(shares);
        }
        return Amounts.mulDiv(shares, totalAssets(), supply);
    }

    private LenderRedemptionRecord settledRecord(String lenderId, long currentEpochId) {
        LenderRedemptionRecord record = repository.findRecord(tranche, lenderId)
            .orElseGet(() -> LenderRedemptionRecord.empty(currentEpochId));
        for (long epochId = record.getLastUpdatedEpochId(); epochId < currentEpochId; epochId++) {
            EpochRedemptionSummary sealed = repository.findSummary(tranche, epochId)
                .filter(EpochRedemptionSummary::isSealed)
                .orElseThrow(() -> new IllegalStateException("Missing sealed summary for epoch"));
            record = record.apply(sealed);
        }
        return record;
    }

    private void requireApproved(String lenderId) {
        if (!isApprovedLender(lenderId)) {
            throw new UnauthorizedException(lenderId + " is not an approved " + tranche.id() + " lender");
        }
    }

    private static CorrelationContext.MdcScope lenderScope(String lenderId) {
        return CorrelationContext.scoped(CorrelationContext.LENDER_MDC_KEY, lenderId);
    }
}
