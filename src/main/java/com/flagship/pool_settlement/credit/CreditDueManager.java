package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.calendar.Calendar;
import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Billing arithmetic for credits. Stateless: every method takes a record and
 * returns a new one without touching storage or funds.
 *
 * Bills are issued at the start of each period and fall due at the start of
 * the next one. A bill still unpaid when its due date arrives rolls into
 * past due, attracts a late fee and counts as a missed period.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreditDueManager {

    private static final BigDecimal YEAR_BPS = BigDecimal.valueOf((long) Calendar.DAYS_IN_A_YEAR * 10_000);

    private final PoolProperties properties;

    public BigDecimal calcFrontLoadingFee(BigDecimal amount) {
        PoolProperties.Credit credit = properties.getCredit();
        return Amounts.scale(credit.getFrontLoadingFeeFlat())
            .add(Amounts.bps(amount, credit.getFrontLoadingFeeBps()));
    }

    public BigDecimal calcLateFee(BigDecimal lateAmount) {
        PoolProperties.Credit credit = properties.getCredit();
        return Amounts.scale(credit.getLateFeeFlat()).add(Amounts.bps(lateAmount, credit.getLateFeeBps()));
    }

    /**
     * principal * yieldBps * days / (360 * 10000), rounded down.
     */
    public BigDecimal calcYield(BigDecimal principal, int yieldBps, long days) {
        return principal
            .multiply(BigDecimal.valueOf(yieldBps))
            .multiply(BigDecimal.valueOf(days))
            .divide(YEAR_BPS, Amounts.SCALE, RoundingMode.DOWN);
    }

    public BigDecimal payoffAmount(CreditRecord record) {
        return record.getPayoffAmount();
    }

    /**
     * Principal written off when the credit defaults: everything drawn and not repaid.
     */
    public BigDecimal principalLoss(CreditRecord record) {
        return record.getPrincipal();
    }

    // ==================== Drawdown ====================

    public CreditRecord applyDrawdown(CreditRecord record, CreditConfig config, BigDecimal amount, LocalDate today) {
        return record.getState() == CreditState.APPROVED
            ? applyFirstDrawdown(record, config, amount, today)
            : applyAdditionalDrawdown(record, config, amount, today);
    }

    private CreditRecord applyFirstDrawdown(CreditRecord record, CreditConfig config, BigDecimal amount,
                                            LocalDate today) {
        PayPeriodDuration duration = config.getPayPeriodDuration();
        LocalDate nextDueDate = Calendar.startOfNextPeriod(duration, today);
        int remainingPeriods = record.getRemainingPeriods() - 1;
        LocalDate maturityDate = nextDueDate.plusMonths((long) duration.getMonths() * remainingPeriods);
        long days = Calendar.daysDiff(today, nextDueDate);

        BigDecimal accrued = calcYield(amount, config.getYieldBps(), days);
        BigDecimal committed = calcYield(config.getCommittedAmount(), config.getYieldBps(), days);
        BigDecimal yieldDue = Amounts.max(accrued, committed);
        BigDecimal principalDue = remainingPeriods == 0 ? amount : Amounts.ZERO;

        log.debug("First drawdown {} on {}: {} days to {}, yieldDue={}", amount, record.getCreditId(), days,
            nextDueDate, yieldDue);

        return record.transitionTo(CreditState.GOOD_STANDING).toBuilder()
            .nextDueDate(nextDueDate)
            .maturityDate(maturityDate)
            .remainingPeriods(remainingPeriods)
            .unbilledPrincipal(amount.subtract(principalDue))
            .yieldDue(yieldDue)
            .nextDue(yieldDue.add(principalDue))
            .missedPeriods(0)
            .dueDetail(DueDetail.empty().toBuilder()
                .accrued(accrued)
                .committed(committed)
                .build())
            .build();
    }

    private CreditRecord applyAdditionalDrawdown(CreditRecord record, CreditConfig config, BigDecimal amount,
                                                 LocalDate today) {
        long days = Calendar.daysDiff(today, record.getNextDueDate());
        DueDetail detail = record.getDueDetail();
        BigDecimal accrued = detail.getAccrued().add(calcYield(amount, config.getYieldBps(), days));
        BigDecimal yieldDue = Amounts.max(Amounts.ZERO,
            Amounts.max(accrued, detail.getCommitted()).subtract(detail.getPaid()));

        BigDecimal principalNextDue = record.getPrincipalNextDue();
        BigDecimal unbilled = record.getUnbilledPrincipal();
        if (record.isFinalPeriod()) {
            principalNextDue = principalNextDue.add(amount);
        } else {
            unbilled = unbilled.add(amount);
        }

        return record.toBuilder()
            .unbilledPrincipal(unbilled)
            .yieldDue(yieldDue)
            .nextDue(yieldDue.add(principalNextDue))
            .dueDetail(detail.toBuilder().accrued(accrued).build())
            .build();
    }

    // ==================== Refresh ====================

    /**
     * Rolls the record forward over every due date up to and including today.
     * Records without a schedule (approved, defaulted, closed) are returned as is.
     */
    public BillRefresh refreshBill(CreditRecord record, CreditConfig config, LocalDate today) {
        if ((record.getState() != CreditState.GOOD_STANDING && record.getState() != CreditState.DELAYED)
            || record.getNextDueDate() == null) {
            return new BillRefresh(record, 0, Amounts.ZERO, false);
        }

        PoolProperties.Credit settings = properties.getCredit();
        PayPeriodDuration duration = config.getPayPeriodDuration();
        CreditRecord current = record;
        int periodsRolled = 0;
        BigDecimal lateFees = Amounts.ZERO;

        while (!today.isBefore(current.getNextDueDate())) {
            DueDetail detail = current.getDueDetail();
            BigDecimal yieldPastDue = detail.getYieldPastDue();
            BigDecimal principalPastDue = detail.getPrincipalPastDue();
            BigDecimal lateFee = detail.getLateFee();
            int missedPeriods = current.getMissedPeriods();

            if (current.getNextDue().signum() > 0 || current.getPastDue().signum() > 0) {
                BigDecimal fee = calcLateFee(current.getNextDue());
                yieldPastDue = yieldPastDue.add(current.getYieldDue());
                principalPastDue = principalPastDue.add(current.getPrincipalNextDue());
                lateFee = lateFee.add(fee);
                lateFees = lateFees.add(fee);
                missedPeriods++;
            }

            BigDecimal unbilled = current.getUnbilledPrincipal();
            int remainingPeriods = current.getRemainingPeriods();
            BigDecimal accrued = Amounts.ZERO;
            BigDecimal committed = Amounts.ZERO;
            BigDecimal yieldDue = Amounts.ZERO;
            BigDecimal principalDue = Amounts.ZERO;

            if (remainingPeriods > 0) {
                remainingPeriods--;
                int days = duration.days();
                accrued = calcYield(unbilled.add(principalPastDue), config.getYieldBps(), days);
                committed = calcYield(config.getCommittedAmount(), config.getYieldBps(), days);
                yieldDue = Amounts.max(accrued, committed);
                principalDue = remainingPeriods == 0
                    ? unbilled
                    : Amounts.bps(unbilled, settings.getPrincipalRateBps());
                unbilled = unbilled.subtract(principalDue);
            }

            current = current.toBuilder()
                .nextDueDate(current.getNextDueDate().plusMonths(duration.getMonths()))
                .remainingPeriods(remainingPeriods)
                .unbilledPrincipal(unbilled)
                .yieldDue(yieldDue)
                .nextDue(yieldDue.add(principalDue))
                .missedPeriods(missedPeriods)
                .dueDetail(DueDetail.builder()
                    .accrued(accrued)
                    .committed(committed)
                    .paid(Amounts.ZERO)
                    .yieldPastDue(yieldPastDue)
                    .principalPastDue(principalPastDue)
                    .lateFee(lateFee)
                    .build())
                .build();
            periodsRolled++;
        }

        boolean defaultDue = current.getMissedPeriods() >= settings.getDefaultAfterMissedPeriods();
        if (!defaultDue && current.getState() == CreditState.GOOD_STANDING
            && current.getMissedPeriods() >= settings.getDelayedAfterMissedPeriods()) {
            current = current.transitionTo(CreditState.DELAYED);
        }

        if (periodsRolled > 0) {
            log.debug("Refreshed {} over {} period(s): nextDue={}, pastDue={}, missed={}", record.getCreditId(),
                periodsRolled, current.getNextDue(), current.getPastDue(), current.getMissedPeriods());
        }
        return new BillRefresh(current, periodsRolled, lateFees, defaultDue);
    }

    // ==================== Payment ====================

    /**
     * Applies a payment in order: late fees, yield past due, principal past due,
     * yield due, principal due, then unbilled principal. Anything above the
     * payoff amount is not taken. The record's state is left for the caller.
     */
    public PaymentAllocation allocatePayment(CreditRecord record, BigDecimal amount) {
        BigDecimal payoff = record.getPayoffAmount();
        BigDecimal amountPaid = Amounts.min(amount, payoff);
        DueDetail detail = record.getDueDetail();

        Allocator allocator = new Allocator(amountPaid);
        BigDecimal lateFeePaid = allocator.take(detail.getLateFee());
        BigDecimal yieldPastDuePaid = allocator.take(detail.getYieldPastDue());
        BigDecimal principalPastDuePaid = allocator.take(detail.getPrincipalPastDue());
        BigDecimal yieldDuePaid = allocator.take(record.getYieldDue());
        BigDecimal principalNextDuePaid = allocator.take(record.getPrincipalNextDue());
        BigDecimal unbilledPaid = allocator.take(record.getUnbilledPrincipal());

        CreditRecord updated = record.toBuilder()
            .yieldDue(record.getYieldDue().subtract(yieldDuePaid))
            .nextDue(record.getNextDue().subtract(yieldDuePaid).subtract(principalNextDuePaid))
            .unbilledPrincipal(record.getUnbilledPrincipal().subtract(unbilledPaid))
            .dueDetail(detail.toBuilder()
                .lateFee(detail.getLateFee().subtract(lateFeePaid))
                .yieldPastDue(detail.getYieldPastDue().subtract(yieldPastDuePaid))
                .principalPastDue(detail.getPrincipalPastDue().subtract(principalPastDuePaid))
                .paid(detail.getPaid().add(yieldDuePaid))
                .build())
            .build();

        return new PaymentAllocation(
            updated,
            amountPaid,
            lateFeePaid,
            yieldPastDuePaid.add(yieldDuePaid),
            principalPastDuePaid.add(principalNextDuePaid).add(unbilledPaid),
            payoff.signum() > 0 && amountPaid.compareTo(payoff) == 0);
    }

    /**
     * Applies a payment to principal only: principal due first, then unbilled
     * principal. Yield and fees are left untouched. Anything above the
     * outstanding principal is not taken.
     */
    public PaymentAllocation allocatePrincipalPayment(CreditRecord record, BigDecimal amount) {
        Allocator allocator = new Allocator(Amounts.min(amount,
            record.getPrincipalNextDue().add(record.getUnbilledPrincipal())));
        BigDecimal principalNextDuePaid = allocator.take(record.getPrincipalNextDue());
        BigDecimal unbilledPaid = allocator.take(record.getUnbilledPrincipal());
        BigDecimal principalPaid = principalNextDuePaid.add(unbilledPaid);

        CreditRecord updated = record.toBuilder()
            .nextDue(record.getNextDue().subtract(principalNextDuePaid))
            .unbilledPrincipal(record.getUnbilledPrincipal().subtract(unbilledPaid))
            .build();

        return new PaymentAllocation(
            updated,
            principalPaid,
            Amounts.ZERO,
            Amounts.ZERO,
            principalPaid,
            principalPaid.signum() > 0 && updated.getPayoffAmount().signum() == 0);
    }

    private static final class Allocator {
        private BigDecimal remaining;

        private Allocator(BigDecimal remaining) {
            this.remaining = remaining;
        }

        private BigDecimal take(BigDecimal bucket) {
            BigDecimal taken = Amounts.min(remaining, bucket);
            remaining = remaining.subtract(taken);
            return taken;
        }
    }
}
