package com.flagship.pool_settlement.receivable;

import com.flagship.pool_settlement.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Registry of receivables submitted by borrowers. Approval and rejection are
 * driven by the receivable credit managers.
 */
@Slf4j
@Service
public class ReceivableRegistry {

    private final ReceivableRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReceivableRegistry(ReceivableRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public Receivable createReceivable(String ownerId, BigDecimal amount, LocalDate maturityDate,
                                       String referenceId) {
        if (maturityDate == null) {
            throw new IllegalArgumentException("maturityDate is required");
        }
        return transactionTemplate.execute(status -> {
            Receivable receivable = repository.save(Receivable.create(UUID.randomUUID().toString(), ownerId, amount,
                maturityDate, referenceId, clock.instant()));
            log.info("Receivable {} created for {}: amount={}, maturity={}", receivable.getReceivableId(), ownerId,
                receivable.getAmount(), maturityDate);
            return receivable;
        });
    }

    public Receivable getReceivable(String receivableId) {
        return repository.findById(receivableId)
            .orElseThrow(() -> new ResourceNotFoundException("Receivable not found: " + receivableId));
    }

    /**
     * Reads the receivable and locks it for the rest of the caller's transaction.
     */
    public Receivable lockReceivable(String receivableId) {
        return repository.findByIdForUpdate(receivableId)
            .orElseThrow(() -> new ResourceNotFoundException("Receivable not found: " + receivableId));
    }

    public Receivable save(Receivable receivable) {
        return transactionTemplate.execute(status -> repository.save(receivable));
    }

    public List<Receivable> findByOwner(String ownerId) {
        return repository.findByOwner(ownerId);
    }
}
