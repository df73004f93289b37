package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.InvalidStateTransitionException;
import com.flagship.pool_settlement.exception.PoolException;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;

/**
 * Administrative side of credits: approval, default, close, refresh.
 *
 * Receivable specific approvals live in {@link ReceivableBackedCreditLineManager}
 * and {@link ReceivableFactoringCreditManager}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditManager {

    private final CreditRepository creditRepository;
    private final CreditService creditService;
    private final TransactionTemplate transactionTemplate;
    private final PoolProperties properties;

    /**
     * Approves a credit line or receivable backed credit line for a borrower.
     * A plain credit line starts with its full limit available; a receivable
     * backed line starts at zero and grows as receivables are approved.
     */
    public CreditRecord approveBorrower(String borrowerId, CreditType creditType, CreditConfig config) {
        if (creditType == CreditType.RECEIVABLE_FACTORING) {
            throw new IllegalArgumentException("Factoring credits are approved per receivable");
        }
        config.validate();
        BigDecimal available = creditType == CreditType.CREDIT_LINE
            ? Amounts.scale(config.getCreditLimit())
            : Amounts.ZERO;
        CreditRecord record = CreditRecord.approved(creditType.creditId(borrowerId), borrowerId, creditType, null,
            config.getNumOfPeriods());
        return creditService.registerCredit(record, config, available);
    }

    /**
     * Defaults a credit whose missed periods reached the default threshold.
     *
     * @throws InvalidStateTransitionException if the credit is not late enough
     */
    public CreditRecord triggerDefault(String creditId) {
        return transactionTemplate.execute(status -> {
            CreditRecord record = creditService.refreshCredit(creditId);
            if (record.getState() == CreditState.DEFAULTED) {
                return record;
            }
            int threshold = properties.getCredit().getDefaultAfterMissedPeriods();
            if (record.getMissedPeriods() < threshold) {
                throw new InvalidStateTransitionException(String.format(
                    "Credit %s missed %d period(s), default requires %d", creditId, record.getMissedPeriods(),
                    threshold));
            }
            return creditService.defaultCredit(record, "default triggered");
        });
    }

    /**
     * Defaults an open credit regardless of its missed periods.
     */
    public CreditRecord forceDefault(String creditId, String reason) {
        return transactionTemplate.execute(status -> {
            CreditRecord record = creditService.refreshCredit(creditId);
            if (record.getState() != CreditState.GOOD_STANDING && record.getState() != CreditState.DELAYED) {
                throw new InvalidStateTransitionException(String.format(
                    "Credit %s is %s and cannot be defaulted", creditId, record.getState()));
            }
            return creditService.defaultCredit(record, reason == null ? "forced default" : reason);
        });
    }

    /**
     * Closes a credit that was never drawn, is fully repaid, or was defaulted (write-off).
     */
    public CreditRecord closeCredit(String creditId) {
        return transactionTemplate.execute(status -> {
            CreditRecord record = creditService.refreshCredit(creditId);
            boolean closable = switch (record.getState()) {
                case APPROVED, DEFAULTED -> true;
                case GOOD_STANDING, DELAYED -> record.getPayoffAmount().signum() == 0;
                case CLOSED -> false;
            };
            if (!closable) {
                throw new InvalidStateTransitionException(String.format(
                    "Credit %s is %s with payoff %s and cannot be closed", creditId, record.getState(),
                    record.getPayoffAmount()));
            }
            creditRepository.setAvailableCredit(creditId, Amounts.ZERO);
            String reason = record.getState() == CreditState.DEFAULTED ? "written off" : "closed";
            return creditService.changeState(record, CreditState.CLOSED, reason);
        });
    }

    public CreditRecord refreshCredit(String creditId) {
        return creditService.refreshCredit(creditId);
    }

    /**
     * Refreshes every credit with a running schedule. Each credit is its own
     * unit, so one failure does not hold back the others.
     *
     * @return number of credits refreshed without error
     */
    public int refreshAll() {
        List<String> creditIds = creditRepository.findBillableIds();
        int refreshed = 0;
        for (String creditId : creditIds) {
            try {
                creditService.refreshCredit(creditId);
                refreshed++;
            } catch (PoolException e) {
                log.warn("Refresh of credit {} rejected [{}]: {}", creditId, e.getErrorCode(), e.getMessage());
            }
        }
        log.debug("Refreshed {}/{} credits", refreshed, creditIds.size());
        return refreshed;
    }

    public BigDecimal availableCredit(String creditId) {
        creditService.getCreditRecord(creditId);
        return creditRepository.getAvailableCredit(creditId);
    }

    public CreditRecord getCreditRecord(String creditId) {
        return creditService.getCreditRecord(creditId);
    }

    public CreditConfig getCreditConfig(String creditId) {
        return creditService.getCreditConfig(creditId);
    }

    public List<CreditRecord> getCreditsForBorrower(String borrowerId) {
        return creditRepository.findByBorrower(borrowerId);
    }
}
