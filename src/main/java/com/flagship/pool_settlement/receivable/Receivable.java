package com.flagship.pool_settlement.receivable;

import com.flagship.pool_settlement.exception.InvalidReceivableStateException;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * An invoice or similar claim a borrower pledges against credit.
 *
 * State changes are immutable: each transition returns a new Receivable.
 */
@Value
@Builder(toBuilder = true)
public class Receivable {
    String receivableId;
    String ownerId;
    BigDecimal amount;
    BigDecimal paidAmount;
    /** Credit drawn against this receivable so far. */
    BigDecimal drawnAmount;
    LocalDate maturityDate;
    String referenceId;
    ReceivableState state;
    Instant createdAt;
    Instant updatedAt;

    public static Receivable create(String receivableId, String ownerId, BigDecimal amount, LocalDate maturityDate,
                                    String referenceId, Instant now) {
        return Receivable.builder()
            .receivableId(receivableId)
            .ownerId(ownerId)
            .amount(Amounts.requirePositive(amount, "amount"))
            .paidAmount(Amounts.ZERO)
            .drawnAmount(Amounts.ZERO)
            .maturityDate(maturityDate)
            .referenceId(referenceId)
            .state(ReceivableState.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public Receivable approve(Instant now) {
        return moveTo(ReceivableState.APPROVED, now);
    }

    public Receivable reject(Instant now) {
        return moveTo(ReceivableState.REJECTED, now);
    }

    /**
     * Records a payment against the receivable; amounts beyond the outstanding balance are ignored.
     */
    public Receivable applyPayment(BigDecimal payment, Instant now) {
        BigDecimal paid = Amounts.min(amount, paidAmount.add(payment));
        ReceivableState target = paid.compareTo(amount) >= 0 ? ReceivableState.PAID : ReceivableState.PARTIALLY_PAID;
        return moveTo(target, now).toBuilder().paidAmount(paid).build();
    }

    public Receivable withDrawdown(BigDecimal amount, Instant now) {
        return toBuilder().drawnAmount(drawnAmount.add(amount)).updatedAt(now).build();
    }

    public BigDecimal getOutstanding() {
        return amount.subtract(paidAmount);
    }

    public boolean isMatured(LocalDate today) {
        return !today.isBefore(maturityDate);
    }

    public boolean isOwnedBy(String borrowerId) {
        return ownerId.equals(borrowerId);
    }

    public boolean canTransitionTo(ReceivableState target) {
        return switch (this.state) {
            case PENDING -> target == ReceivableState.APPROVED || target == ReceivableState.REJECTED;
            case APPROVED -> target == ReceivableState.PARTIALLY_PAID || target == ReceivableState.PAID;
            case PARTIALLY_PAID -> target == ReceivableState.PARTIALLY_PAID || target == ReceivableState.PAID;
            case REJECTED, PAID -> false;
        };
    }

    private Receivable moveTo(ReceivableState target, Instant now) {
        if (!canTransitionTo(target)) {
            throw new InvalidReceivableStateException(String.format(
                "Receivable %s cannot move from %s to %s", receivableId, state, target));
        }
        return toBuilder().state(target).updatedAt(now).build();
    }
}
