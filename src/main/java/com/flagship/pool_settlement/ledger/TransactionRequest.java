package com.flagship.pool_settlement.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Request object for posting a custody transaction.
 * Contains debits and credits that must balance.
 */
@Value
public class TransactionRequest {
    String description;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    public static TransactionRequest transfer(String fromAccount, String toAccount, BigDecimal amount,
                                              String description) {
        return new TransactionRequest(
            description,
            List.of(DebitCredit.of(toAccount, amount, description)),
            List.of(DebitCredit.of(fromAccount, amount, description)));
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return debits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return credits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Value
    public static class DebitCredit {
        String accountName;
        BigDecimal amount;
        String description;

        private DebitCredit(String accountName, BigDecimal amount, String description) {
            this.accountName = Objects.requireNonNull(accountName);
            this.amount = Objects.requireNonNull(amount);
            if (amount.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.description = description;
        }

        public static DebitCredit of(String accountName, BigDecimal amount, String description) {
            return new DebitCredit(accountName, amount, description);
        }
    }
}
