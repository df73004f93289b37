package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.InsufficientCreditException;
import com.flagship.pool_settlement.exception.InvalidReceivableStateException;
import com.flagship.pool_settlement.exception.MaturityExceededException;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.receivable.Receivable;
import com.flagship.pool_settlement.receivable.ReceivableRegistry;
import com.flagship.pool_settlement.receivable.ReceivableState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Borrower facing operations of a credit line whose availability is backed
 * by approved receivables.
 *
 * Each receivable backs at most its amount times the advance rate over its
 * lifetime. Receivable rows are locked before the credit row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceivableBackedCreditLine {

    private final CreditService creditService;
    private final CreditRepository creditRepository;
    private final ReceivableRegistry receivableRegistry;
    private final TransactionTemplate transactionTemplate;
    private final PoolProperties properties;
    private final Clock clock;

    /**
     * Draws against an approved receivable, up to the part of its advance not drawn yet.
     *
     * @throws InsufficientCreditException if the amount exceeds the receivable's remaining advance
     */
    public DrawdownResult drawdownWithReceivable(String borrowerId, String receivableId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        return transactionTemplate.execute(status -> {
            String creditId = creditIdFor(borrowerId);
            Receivable receivable = ownedReceivable(borrowerId, receivableId);
            if (receivable.getState() != ReceivableState.APPROVED) {
                throw new InvalidReceivableStateException(String.format(
                    "Receivable %s is %s, only approved receivables can back a drawdown",
                    receivableId, receivable.getState()));
            }
            if (receivable.isMatured(LocalDate.now(clock))) {
                throw new MaturityExceededException(String.format(
                    "Receivable %s matured on %s", receivableId, receivable.getMaturityDate()));
            }
            BigDecimal advance = Amounts.bps(receivable.getAmount(), properties.getCredit().getAdvanceRateBps());
            BigDecimal remaining = advance.subtract(receivable.getDrawnAmount());
            if (value.compareTo(remaining) > 0) {
                throw new InsufficientCreditException(String.format(
                    "Drawdown %s exceeds the %s left of the %s advance on receivable %s",
                    value, remaining, advance, receivableId));
            }

            DrawdownResult result = creditService.drawdown(creditId, value);
            receivableRegistry.save(receivable.withDrawdown(value, clock.instant()));
            return result;
        });
    }

    /**
     * Pays the credit and records the amount collected against the receivable.
     */
    public PaymentResult makePaymentWithReceivable(String borrowerId, String receivableId, BigDecimal amount) {
        return transactionTemplate.execute(status -> {
            String creditId = creditIdFor(borrowerId);
            Receivable receivable = payableReceivable(borrowerId, receivableId);
            PaymentResult result = creditService.makePayment(creditId, CustodyAccounts.borrower(borrowerId), amount);
            if (result.getAmountPaid().signum() > 0) {
                receivableRegistry.save(receivable.applyPayment(result.getAmountPaid(), clock.instant()));
            }
            return result;
        });
    }

    /**
     * Pays down principal and records the amount collected against the receivable.
     */
    public PaymentResult makePrincipalPaymentWithReceivable(String borrowerId, String receivableId,
                                                           BigDecimal amount) {
        return transactionTemplate.execute(status -> {
            String creditId = creditIdFor(borrowerId);
            Receivable receivable = payableReceivable(borrowerId, receivableId);
            PaymentResult result = creditService.makePrincipalPayment(creditId, CustodyAccounts.borrower(borrowerId),
                amount);
            if (result.getAmountPaid().signum() > 0) {
                receivableRegistry.save(receivable.applyPayment(result.getAmountPaid(), clock.instant()));
            }
            return result;
        });
    }

    /**
     * Pays down principal against one receivable and draws against another in a
     * single transaction. If the drawdown fails the payment is not kept either.
     */
    public PrincipalPaymentAndDrawdownResult makePrincipalPaymentAndDrawdownWithReceivable(
            String borrowerId,
            String paymentReceivableId,
            BigDecimal paymentAmount,
            String drawdownReceivableId,
            BigDecimal drawdownAmount) {
        if (paymentReceivableId.equals(drawdownReceivableId)) {
            throw new IllegalArgumentException("Payment and drawdown must use different receivables");
        }
        return transactionTemplate.execute(status -> {
            // Both receivables are locked in id order before the credit row.
            if (paymentReceivableId.compareTo(drawdownReceivableId) < 0) {
                receivableRegistry.lockReceivable(paymentReceivableId);
                receivableRegistry.lockReceivable(drawdownReceivableId);
            } else {
                receivableRegistry.lockReceivable(drawdownReceivableId);
                receivableRegistry.lockReceivable(paymentReceivableId);
            }
            PaymentResult payment = makePrincipalPaymentWithReceivable(borrowerId, paymentReceivableId,
                paymentAmount);
            DrawdownResult drawdown = drawdownWithReceivable(borrowerId, drawdownReceivableId, drawdownAmount);
            log.info("Principal payment {} on receivable {} and drawdown {} on receivable {} for {}",
                payment.getAmountPaid(), paymentReceivableId, drawdown.getAmount(), drawdownReceivableId,
                borrowerId);
            return new PrincipalPaymentAndDrawdownResult(payment, drawdown);
        });
    }

    public PaymentResult makePayment(String borrowerId, BigDecimal amount) {
        return creditService.makePayment(creditIdFor(borrowerId), CustodyAccounts.borrower(borrowerId), amount);
    }

    public BigDecimal payoffAmount(String borrowerId) {
        return creditService.payoffAmount(creditIdFor(borrowerId));
    }

    public CreditRecord getCreditRecord(String borrowerId) {
        return creditService.getCreditRecord(creditIdFor(borrowerId));
    }

    private Receivable payableReceivable(String borrowerId, String receivableId) {
        Receivable receivable = ownedReceivable(borrowerId, receivableId);
        if (receivable.getState() != ReceivableState.APPROVED
            && receivable.getState() != ReceivableState.PARTIALLY_PAID) {
            throw new InvalidReceivableStateException(String.format(
                "Receivable %s is %s and cannot take payments", receivableId, receivable.getState()));
        }
        return receivable;
    }

    private Receivable ownedReceivable(String borrowerId, String receivableId) {
        Receivable receivable = receivableRegistry.lockReceivable(receivableId);
        if (!receivable.isOwnedBy(borrowerId)) {
            throw new UnauthorizedException("Receivable " + receivableId + " is not owned by " + borrowerId);
        }
        return receivable;
    }

    private String creditIdFor(String borrowerId) {
        String creditId = CreditType.RECEIVABLE_BACKED_CREDIT_LINE.creditId(borrowerId);
        if (creditRepository.findById(creditId).isEmpty()) {
            throw new UnauthorizedException("Borrower " + borrowerId + " has no receivable backed credit line");
        }
        return creditId;
    }
}
