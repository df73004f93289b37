package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.event.CreditStateChangedEvent;
import com.flagship.pool_settlement.event.DrawdownMadeEvent;
import com.flagship.pool_settlement.event.EventJournal;
import com.flagship.pool_settlement.event.PaymentMadeEvent;
import com.flagship.pool_settlement.exception.InsufficientCreditException;
import com.flagship.pool_settlement.exception.InvalidStateTransitionException;
import com.flagship.pool_settlement.exception.MaturityExceededException;
import com.flagship.pool_settlement.exception.ResourceNotFoundException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.observability.CorrelationContext;
import com.flagship.pool_settlement.observability.PoolMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Core credit engine shared by every credit variant: refresh, drawdown,
 * payment and default.
 *
 * Each public operation runs in one database transaction that locks the
 * credit row first and the pool row next. Profit (front-loading
 * fees, late fees, yield) is handed to the pool when collected; principal is not.
 * A default hands the outstanding principal to the pool as a loss, and later
 * payments on the defaulted credit are loss recoveries.
 */
@Slf4j
@Service
public class CreditService {

    private final CreditRepository creditRepository;
    private final CreditDueManager dueManager;
    private final Pool pool;
    private final LedgerService ledgerService;
    private final TransactionTemplate transactionTemplate;
    private final EventJournal eventJournal;
    private final PoolMetrics metrics;
    private final Clock clock;

    public CreditService(CreditRepository creditRepository,
                         CreditDueManager dueManager,
                         Pool pool,
                         LedgerService ledgerService,
                         TransactionTemplate transactionTemplate,
                         EventJournal eventJournal,
                         PoolMetrics metrics,
                         Clock clock) {
        this.creditRepository = creditRepository;
        this.dueManager = dueManager;
        this.pool = pool;
        this.ledgerService = ledgerService;
        this.transactionTemplate = transactionTemplate;
        this.eventJournal = eventJournal;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CreditRecord getCreditRecord(String creditId) {
        return creditRepository.findById(creditId)
            .orElseThrow(() -> new ResourceNotFoundException("Credit not found: " + creditId));
    }

    public CreditConfig getCreditConfig(String creditId) {
        return creditRepository.findConfig(creditId)
            .orElseThrow(() -> new ResourceNotFoundException("Credit not found: " + creditId));
    }

    /**
     * Stores a newly approved credit. Fails if the key already holds a credit that is not closed.
     */
    public CreditRecord registerCredit(CreditRecord record, CreditConfig config, BigDecimal availableCredit) {
        return transactionTemplate.execute(status -> {
            creditRepository.findById(record.getCreditId())
                .filter(existing -> !existing.isTerminal())
                .ifPresent(existing -> {
                    throw new InvalidStateTransitionException(String.format(
                        "Credit %s already exists in state %s", existing.getCreditId(), existing.getState()));
                });

            ledgerService.openAccount(CustodyAccounts.borrower(record.getBorrowerId()), Account.AccountType.EXTERNAL);
            creditRepository.create(record, config, availableCredit);

            eventJournal.record(CreditStateChangedEvent.of(record.getCreditId(), null, record.getState().name(),
                "approved", clock.instant()));
            metrics.recordCreditStateTransition(record.getState().name());
            log.info("Credit {} approved for {}: limit={}, yieldBps={}, periods={}", record.getCreditId(),
                record.getBorrowerId(), config.getCreditLimit(), config.getYieldBps(), config.getNumOfPeriods());
            return record;
        });
    }

    /**
     * Payoff as of today, including bills that rolled since the last stored refresh.
     */
    public BigDecimal payoffAmount(String creditId) {
        CreditRecord record = getCreditRecord(creditId);
        BillRefresh refresh = dueManager.refreshBill(record, getCreditConfig(creditId), today());
        return dueManager.payoffAmount(refresh.getRecord());
    }

    /**
     * Brings the stored record up to today, defaulting it if too many periods were missed.
     */
    public CreditRecord refreshCredit(String creditId) {
        try (CorrelationContext.MdcScope ignored = creditScope(creditId)) {
            return transactionTemplate.execute(status -> {
                CreditRecord record = creditRepository.findByIdForUpdate(creditId)
                    .orElseThrow(() -> new ResourceNotFoundException("Credit not found: " + creditId));
                BillRefresh refresh = dueManager.refreshBill(record, getCreditConfig(creditId), today());
                if (refresh.getPeriodsRolled() == 0) {
                    return record;
                }

                CreditRecord refreshed = creditRepository.save(refresh.getRecord());
                if (refreshed.getState() != record.getState()) {
                    recordTransition(creditId, record.getState(), refreshed.getState(), "missed payment");
                }
                if (refresh.isDefaultDue()) {
                    return defaultCredit(refreshed, "missed " + refreshed.getMissedPeriods() + " periods");
                }
                return refreshed;
            });
        }
    }

    /**
     * @throws InsufficientCreditException if the amount exceeds available credit
     * @throws MaturityExceededException if the credit has matured
     */
    public DrawdownResult drawdown(String creditId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        try (CorrelationContext.MdcScope ignored = creditScope(creditId)) {
            return transactionTemplate.execute(status -> {
                pool.requireEnabled();
                CreditRecord record = refreshCredit(creditId);
                pool.lockState();
                CreditConfig config = getCreditConfig(creditId);
                LocalDate today = today();

                if (record.getState() != CreditState.APPROVED && record.getState() != CreditState.GOOD_STANDING) {
                    throw new InvalidStateTransitionException(String.format(
                        "Credit %s is %s, drawdown not allowed", creditId, record.getState()));
                }
                if (record.getMaturityDate() != null && !today.isBefore(record.getMaturityDate())) {
                    throw new MaturityExceededException(String.format(
                        "Credit %s matured on %s", creditId, record.getMaturityDate()));
                }
                BigDecimal available = creditRepository.getAvailableCredit(creditId);
                if (value.compareTo(available) > 0) {
                    throw new InsufficientCreditException(String.format(
                        "Drawdown %s exceeds available credit %s", value, available));
                }
                BigDecimal fee = dueManager.calcFrontLoadingFee(value);
                if (value.compareTo(fee) <= 0) {
                    throw new IllegalArgumentException(String.format(
                        "Drawdown %s does not cover front loading fee %s", value, fee));
                }

                CreditRecord updated = creditRepository.save(dueManager.applyDrawdown(record, config, value, today));
                creditRepository.setAvailableCredit(creditId, available.subtract(value));
                if (record.getState() != updated.getState()) {
                    recordTransition(creditId, record.getState(), updated.getState(), "first drawdown");
                }

                BigDecimal netAmount = value.subtract(fee);
                UUID transactionId = ledgerService.transfer(CustodyAccounts.POOL_SAFE,
                    CustodyAccounts.borrower(record.getBorrowerId()), netAmount, "Drawdown " + creditId);
                if (fee.signum() > 0) {
                    pool.distributeProfit(fee);
                }

                eventJournal.record(DrawdownMadeEvent.of(creditId, record.getBorrowerId(), value, fee, netAmount,
                    transactionId, clock.instant()));
                metrics.recordDrawdown(record.getCreditType().name(), value);
                log.info("Drawdown {} on {} (fee {}, net {}), nextDue {} on {}", value, creditId, fee, netAmount,
                    updated.getNextDue(), updated.getNextDueDate());

                return new DrawdownResult(creditId, value, fee, netAmount, updated);
            });
        }
    }

    /**
     * Collects a payment from the given custody account.
     *
     * Amounts above the payoff are not taken. On a defaulted credit the whole
     * payment is a loss recovery.
     */
    public PaymentResult makePayment(String creditId, String payerAccount, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        try (CorrelationContext.MdcScope ignored = creditScope(creditId)) {
            return transactionTemplate.execute(status -> {
                pool.requireEnabled();
                CreditRecord record = refreshCredit(creditId);
                pool.lockState();
                CreditConfig config = getCreditConfig(creditId);

                if (record.getState() == CreditState.APPROVED || record.getState() == CreditState.CLOSED) {
                    throw new InvalidStateTransitionException(String.format(
                        "Credit %s is %s, nothing to pay", creditId, record.getState()));
                }

                PaymentAllocation allocation = dueManager.allocatePayment(record, value);
                BigDecimal paid = allocation.getAmountPaid();
                if (paid.signum() == 0) {
                    return new PaymentResult(creditId, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, false, false,
                        record);
                }
                ledgerService.transfer(payerAccount, CustodyAccounts.POOL_SAFE, paid, "Payment " + creditId);

                boolean lossRecovery = record.getState() == CreditState.DEFAULTED;
                CreditRecord updated = allocation.getRecord();
                if (lossRecovery) {
                    if (allocation.isPaidOff()) {
                        updated = updated.transitionTo(CreditState.CLOSED);
                    }
                } else {
                    updated = settleState(updated, allocation.isPaidOff());
                    if (config.isRevolving() && allocation.getPrincipalPaid().signum() > 0) {
                        BigDecimal restored = Amounts.min(config.getCreditLimit(),
                            creditRepository.getAvailableCredit(creditId).add(allocation.getPrincipalPaid()));
                        creditRepository.setAvailableCredit(creditId, restored);
                    }
                }
                creditRepository.save(updated);
                if (updated.getState() != record.getState()) {
                    recordTransition(creditId, record.getState(), updated.getState(),
                        lossRecovery ? "recovered after default" : "payment");
                }

                if (lossRecovery) {
                    pool.distributeLossRecovery(paid);
                } else if (allocation.getIncomePaid().signum() > 0) {
                    pool.distributeProfit(allocation.getIncomePaid());
                }

                eventJournal.record(PaymentMadeEvent.of(creditId, payerAccount, paid, allocation.getIncomePaid(),
                    allocation.getPrincipalPaid(), lossRecovery, allocation.isPaidOff(), clock.instant()));
                metrics.recordPayment(record.getCreditType().name(), paid);
                log.info("Payment {} on {}: income={}, principal={}, state={}", paid, creditId,
                    allocation.getIncomePaid(), allocation.getPrincipalPaid(), updated.getState());

                return new PaymentResult(creditId, paid, allocation.getIncomePaid(), allocation.getPrincipalPaid(),
                    allocation.isPaidOff(), lossRecovery, updated);
            });
        }
    }

    /**
     * Pays down principal only, leaving yield and fees billed. Only allowed
     * while nothing is past due.
     *
     * @throws InvalidStateTransitionException if the credit is not in good standing
     */
    public PaymentResult makePrincipalPayment(String creditId, String payerAccount, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        try (CorrelationContext.MdcScope ignored = creditScope(creditId)) {
            return transactionTemplate.execute(status -> {
                pool.requireEnabled();
                CreditRecord record = refreshCredit(creditId);
                pool.lockState();
                CreditConfig config = getCreditConfig(creditId);

                if (record.getState() != CreditState.GOOD_STANDING) {
                    throw new InvalidStateTransitionException(String.format(
                        "Credit %s is %s, principal payments need good standing", creditId, record.getState()));
                }

                PaymentAllocation allocation = dueManager.allocatePrincipalPayment(record, value);
                BigDecimal paid = allocation.getAmountPaid();
                if (paid.signum() == 0) {
                    return new PaymentResult(creditId, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, false, false,
                        record);
                }
                ledgerService.transfer(payerAccount, CustodyAccounts.POOL_SAFE, paid, "Principal payment " + creditId);

                CreditRecord updated = settleState(allocation.getRecord(), allocation.isPaidOff());
                if (config.isRevolving()) {
                    BigDecimal restored = Amounts.min(config.getCreditLimit(),
                        creditRepository.getAvailableCredit(creditId).add(paid));
                    creditRepository.setAvailableCredit(creditId, restored);
                }
                creditRepository.save(updated);
                if (updated.getState() != record.getState()) {
                    recordTransition(creditId, record.getState(), updated.getState(), "principal payment");
                }

                eventJournal.record(PaymentMadeEvent.of(creditId, payerAccount, paid, Amounts.ZERO, paid, false,
                    allocation.isPaidOff(), clock.instant()));
                metrics.recordPayment(record.getCreditType().name(), paid);
                log.info("Principal payment {} on {}: unbilled={}, nextDue={}", paid, creditId,
                    updated.getUnbilledPrincipal(), updated.getNextDue());

                return new PaymentResult(creditId, paid, Amounts.ZERO, paid, allocation.isPaidOff(), false, updated);
            });
        }
    }

    /**
     * Marks the credit defaulted and hands its outstanding principal to the pool as a loss.
     */
    public CreditRecord defaultCredit(CreditRecord record, String reason) {
        return transactionTemplate.execute(status -> {
            CreditRecord defaulted = creditRepository.save(record.transitionTo(CreditState.DEFAULTED));
            creditRepository.setAvailableCredit(record.getCreditId(), Amounts.ZERO);
            BigDecimal principalLoss = dueManager.principalLoss(defaulted);

            recordTransition(record.getCreditId(), record.getState(), CreditState.DEFAULTED, reason);
            pool.distributeLoss(principalLoss);

            log.warn("Credit {} defaulted ({}), principal loss {}", record.getCreditId(), reason, principalLoss);
            return defaulted;
        });
    }

    /**
     * Records a state change made by a manager.
     */
    public CreditRecord changeState(CreditRecord record, CreditState target, String reason) {
        return transactionTemplate.execute(status -> {
            CreditRecord updated = creditRepository.save(record.transitionTo(target));
            if (record.getState() != target) {
                recordTransition(record.getCreditId(), record.getState(), target, reason);
            }
            return updated;
        });
    }

    private CreditRecord settleState(CreditRecord record, boolean paidOff) {
        if (paidOff && record.isFinalPeriod()) {
            return record.transitionTo(CreditState.CLOSED).toBuilder().missedPeriods(0).build();
        }
        if (record.getPastDue().signum() == 0) {
            return record.transitionTo(CreditState.GOOD_STANDING).toBuilder().missedPeriods(0).build();
        }
        return record;
    }

    private void recordTransition(String creditId, CreditState from, CreditState to, String reason) {
        eventJournal.record(CreditStateChangedEvent.of(creditId, from.name(), to.name(), reason, clock.instant()));
        metrics.recordCreditStateTransition(to.name());
        log.info("Credit {} {} -> {} ({})", creditId, from, to, reason);
    }

    private static CorrelationContext.MdcScope creditScope(String creditId) {
        return CorrelationContext.scoped(CorrelationContext.CREDIT_ID_MDC_KEY, creditId);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
