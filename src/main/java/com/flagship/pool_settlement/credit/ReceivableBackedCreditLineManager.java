package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.InvalidStateTransitionException;
import com.flagship.pool_settlement.exception.MaturityExceededException;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.receivable.Receivable;
import com.flagship.pool_settlement.receivable.ReceivableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Approves and rejects receivables pledged to a receivable backed credit line.
 * Each approval raises available credit by the receivable amount times the
 * advance rate, capped at the credit limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceivableBackedCreditLineManager {

    private final CreditRepository creditRepository;
    private final CreditService creditService;
    private final ReceivableRegistry receivableRegistry;
    private final TransactionTemplate transactionTemplate;
    private final PoolProperties properties;
    private final Clock clock;

    /**
     * @return available credit after the approval
     */
    public BigDecimal approveReceivable(String borrowerId, String receivableId) {
        return transactionTemplate.execute(status -> {
            String creditId = requireCreditId(borrowerId);
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            CreditRecord record = creditService.refreshCredit(creditId);
            if (record.getState() == CreditState.DEFAULTED || record.getState() == CreditState.CLOSED) {
                throw new InvalidStateTransitionException(String.format(
                    "Credit %s is %s, receivables can no longer be approved", creditId, record.getState()));
            }

            if (!receivable.isOwnedBy(borrowerId)) {
                throw new UnauthorizedException("Receivable " + receivableId + " is not owned by " + borrowerId);
            }
            if (receivable.isMatured(LocalDate.now(clock))) {
                throw new MaturityExceededException(String.format(
                    "Receivable %s matured on %s", receivableId, receivable.getMaturityDate()));
            }
            receivableRegistry.save(receivable.approve(clock.instant()));

            CreditConfig config = creditService.getCreditConfig(creditId);
            BigDecimal incremental = Amounts.bps(receivable.getAmount(), properties.getCredit().getAdvanceRateBps());
            BigDecimal available = Amounts.min(Amounts.scale(config.getCreditLimit()),
                creditRepository.getAvailableCredit(creditId).add(incremental));
            creditRepository.setAvailableCredit(creditId, available);

            log.info("Receivable {} approved for {}: +{} available, now {}", receivableId, creditId, incremental,
                available);
            return available;
        });
    }

    public Receivable rejectReceivable(String borrowerId, String receivableId) {
        return transactionTemplate.execute(status -> {
            requireCreditId(borrowerId);
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            if (!receivable.isOwnedBy(borrowerId)) {
                throw new UnauthorizedException("Receivable " + receivableId + " is not owned by " + borrowerId);
            }
            Receivable rejected = receivableRegistry.save(receivable.reject(clock.instant()));
            log.info("Receivable {} rejected for {}", receivableId, borrowerId);
            return rejected;
        });
    }

    private String requireCreditId(String borrowerId) {
        String creditId = CreditType.RECEIVABLE_BACKED_CREDIT_LINE.creditId(borrowerId);
        if (creditRepository.findById(creditId).isEmpty()) {
            throw new UnauthorizedException("Borrower " + borrowerId + " has no receivable backed credit line");
        }
        return creditId;
    }
}
