package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.exception.InvalidReceivableStateException;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.receivable.Receivable;
import com.flagship.pool_settlement.receivable.ReceivableRegistry;
import com.flagship.pool_settlement.receivable.ReceivableState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Drawdown and repayment of factoring credits. Repayment usually comes from
 * the receivable's debtor rather than the borrower.
 */
@Service
@RequiredArgsConstructor
public class ReceivableFactoringCredit {

    private final CreditService creditService;
    private final CreditRepository creditRepository;
    private final ReceivableRegistry receivableRegistry;
    private final LedgerService ledgerService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DrawdownResult drawdownWithReceivable(String borrowerId, String receivableId, BigDecimal amount) {
        return transactionTemplate.execute(status -> {
            String creditId = CreditType.RECEIVABLE_FACTORING.creditId(borrowerId, receivableId);
            if (creditRepository.findById(creditId).isEmpty()) {
                throw new UnauthorizedException(String.format(
                    "Borrower %s has no factoring credit on receivable %s", borrowerId, receivableId));
            }
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            if (receivable.getState() != ReceivableState.APPROVED) {
                throw new InvalidReceivableStateException(String.format(
                    "Receivable %s is %s, drawdown not allowed", receivableId, receivable.getState()));
            }
            return creditService.drawdown(creditId, amount);
        });
    }

    /**
     * Pays a factoring credit on behalf of its receivable. The payer may be the
     * borrower or any third party such as the receivable's debtor.
     */
    public PaymentResult makePaymentWithReceivable(String payerId, String receivableId, BigDecimal amount) {
        return transactionTemplate.execute(status -> {
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            if (receivable.getState() != ReceivableState.APPROVED
                && receivable.getState() != ReceivableState.PARTIALLY_PAID) {
                throw new InvalidReceivableStateException(String.format(
                    "Receivable %s is %s and cannot take payments", receivableId, receivable.getState()));
            }
            String creditId = CreditType.RECEIVABLE_FACTORING.creditId(receivable.getOwnerId(), receivableId);

            String payerAccount;
            if (receivable.isOwnedBy(payerId)) {
                payerAccount = CustodyAccounts.borrower(payerId);
            } else {
                payerAccount = CustodyAccounts.payer(payerId);
                ledgerService.openAccount(payerAccount, Account.AccountType.EXTERNAL);
            }

            PaymentResult result = creditService.makePayment(creditId, payerAccount, amount);
            if (result.getAmountPaid().signum() > 0) {
                receivableRegistry.save(receivable.applyPayment(result.getAmountPaid(), clock.instant()));
            }
            return result;
        });
    }

    public BigDecimal payoffAmount(String borrowerId, String receivableId) {
        return creditService.payoffAmount(CreditType.RECEIVABLE_FACTORING.creditId(borrowerId, receivableId));
    }

    public CreditRecord getCreditRecord(String borrowerId, String receivableId) {
        return creditService.getCreditRecord(CreditType.RECEIVABLE_FACTORING.creditId(borrowerId, receivableId));
    }
}
