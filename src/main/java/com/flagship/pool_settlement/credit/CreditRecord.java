package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.exception.InvalidStateTransitionException;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Billing state of one credit.
 *
 * Key principles:
 * - nextDue = yieldDue + principal billed for the current period
 * - pastDue = yield past due + principal past due + late fees
 * - State transitions are explicit and validated
 * - Changes produce a new record; records are never edited in place
 */
@Value
@Builder(toBuilder = true)
public class CreditRecord {
    String creditId;
    String borrowerId;
    CreditType creditType;
    String receivableId;
    CreditState state;
    BigDecimal unbilledPrincipal;
    LocalDate nextDueDate;
    LocalDate maturityDate;
    BigDecimal nextDue;
    BigDecimal yieldDue;
    DueDetail dueDetail;
    int missedPeriods;
    int remainingPeriods;

    public static CreditRecord approved(String creditId, String borrowerId, CreditType creditType,
                                        String receivableId, int numOfPeriods) {
        return CreditRecord.builder()
            .creditId(creditId)
            .borrowerId(borrowerId)
            .creditType(creditType)
            .receivableId(receivableId)
            .state(CreditState.APPROVED)
            .unbilledPrincipal(Amounts.ZERO)
            .nextDue(Amounts.ZERO)
            .yieldDue(Amounts.ZERO)
            .dueDetail(DueDetail.empty())
            .missedPeriods(0)
            .remainingPeriods(numOfPeriods)
            .build();
    }

    public BigDecimal getPastDue() {
        return dueDetail.pastDue();
    }

    /**
     * Principal billed in the current, not yet due, bill.
     */
    public BigDecimal getPrincipalNextDue() {
        return nextDue.subtract(yieldDue);
    }

    /**
     * All outstanding principal, billed or not.
     */
    public BigDecimal getPrincipal() {
        return unbilledPrincipal.add(dueDetail.getPrincipalPastDue()).add(getPrincipalNextDue());
    }

    public BigDecimal getTotalDue() {
        return getPastDue().add(nextDue);
    }

    public BigDecimal getPayoffAmount() {
        return getTotalDue().add(unbilledPrincipal);
    }

    public boolean isFinalPeriod() {
        return remainingPeriods == 0;
    }

    public boolean isTerminal() {
        return state == CreditState.CLOSED;
    }

    /**
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public CreditRecord transitionTo(CreditState target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateTransitionException(
                String.format("Credit %s cannot move from %s to %s", creditId, state, target));
        }
        return toBuilder().state(target).build();
    }

    public boolean canTransitionTo(CreditState target) {
        if (this.state == target) {
            return true;
        }

        return switch (this.state) {
            case APPROVED -> target == CreditState.GOOD_STANDING || target == CreditState.CLOSED;
            case GOOD_STANDING -> target == CreditState.DELAYED || target == CreditState.DEFAULTED
                || target == CreditState.CLOSED;
            case DELAYED -> target == CreditState.GOOD_STANDING || target == CreditState.DEFAULTED
                || target == CreditState.CLOSED;
            case DEFAULTED -> target == CreditState.CLOSED;
            case CLOSED -> false;
        };
    }
}
