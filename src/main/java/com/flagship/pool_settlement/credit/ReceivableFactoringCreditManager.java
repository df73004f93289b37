package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.calendar.Calendar;
import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.config.PoolProperties;
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
 * Approves receivables for factoring. Every approved receivable opens its own
 * non-revolving credit with a limit of amount times the advance rate and a
 * term running to the receivable's maturity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceivableFactoringCreditManager {

    private final CreditService creditService;
    private final ReceivableRegistry receivableRegistry;
    private final TransactionTemplate transactionTemplate;
    private final PoolProperties properties;
    private final Clock clock;

    public CreditRecord approveReceivable(String borrowerId, String receivableId, int yieldBps) {
        return transactionTemplate.execute(status -> {
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            if (!receivable.isOwnedBy(borrowerId)) {
                throw new UnauthorizedException("Receivable " + receivableId + " is not owned by " + borrowerId);
            }
            LocalDate today = LocalDate.now(clock);
            if (receivable.isMatured(today)) {
                throw new MaturityExceededException(String.format(
                    "Receivable %s matured on %s", receivableId, receivable.getMaturityDate()));
            }
            receivableRegistry.save(receivable.approve(clock.instant()));

            PayPeriodDuration duration = properties.getPayPeriodDuration();
            BigDecimal limit = Amounts.bps(receivable.getAmount(), properties.getCredit().getAdvanceRateBps());
            CreditConfig config = CreditConfig.builder()
                .creditLimit(limit)
                .committedAmount(Amounts.ZERO)
                .yieldBps(yieldBps)
                .numOfPeriods(Calendar.periodsUntil(duration, today, receivable.getMaturityDate()))
                .payPeriodDuration(duration)
                .revolving(false)
                .build()
                .validate();

            String creditId = CreditType.RECEIVABLE_FACTORING.creditId(borrowerId, receivableId);
            CreditRecord record = CreditRecord.approved(creditId, borrowerId, CreditType.RECEIVABLE_FACTORING,
                receivableId, config.getNumOfPeriods());
            log.info("Factoring receivable {} for {}: limit {}, {} period(s)", receivableId, borrowerId, limit,
                config.getNumOfPeriods());
            return creditService.registerCredit(record, config, limit);
        });
    }

    public Receivable rejectReceivable(String borrowerId, String receivableId) {
        return transactionTemplate.execute(status -> {
            Receivable receivable = receivableRegistry.lockReceivable(receivableId);
            if (!receivable.isOwnedBy(borrowerId)) {
                throw new UnauthorizedException("Receivable " + receivableId + " is not owned by " + borrowerId);
            }
            Receivable rejected = receivableRegistry.save(receivable.reject(clock.instant()));
            log.info("Factoring receivable {} rejected for {}", receivableId, borrowerId);
            return rejected;
        });
    }
}
