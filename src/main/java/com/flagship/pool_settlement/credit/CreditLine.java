package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Borrower facing operations of a plain credit line.
 */
@Service
@RequiredArgsConstructor
public class CreditLine {

    private final CreditService creditService;
    private final CreditRepository creditRepository;

    public DrawdownResult drawdown(String borrowerId, BigDecimal amount) {
        return creditService.drawdown(creditIdFor(borrowerId), amount);
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

    private String creditIdFor(String borrowerId) {
        String creditId = CreditType.CREDIT_LINE.creditId(borrowerId);
        if (creditRepository.findById(creditId).isEmpty()) {
            throw new UnauthorizedException("Borrower " + borrowerId + " has no approved credit line");
        }
        return creditId;
    }
}
