package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.ResourceNotFoundException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The pool's first-loss covers, ordered by rank. Lower ranks absorb losses first
 * and are repaid last.
 */
@Slf4j
@Component
public class FirstLossCovers {

    private final List<FirstLossCover> absorptionOrder;
    private final List<FirstLossCover> recoveryOrder;

    public FirstLossCovers(PoolProperties properties, LedgerService ledgerService,
                           FirstLossCoverRepository repository) {
        List<FirstLossCover> covers = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (PoolProperties.FirstLossCover config : properties.getFirstLossCovers()) {
            if (!ids.add(config.getId())) {
                throw new IllegalArgumentException("Duplicate first loss cover id: " + config.getId());
            }
            FirstLossCover cover = new FirstLossCover(config, repository);
            repository.initialize(cover.getCoverId());
            ledgerService.openAccount(cover.getAccountName(), Account.AccountType.INTERNAL);
            covers.add(cover);
        }
        covers.sort(Comparator.comparingInt(FirstLossCover::getRank));

        this.absorptionOrder = Collections.unmodifiableList(covers);
        List<FirstLossCover> reversed = new ArrayList<>(covers);
        Collections.reverse(reversed);
        this.recoveryOrder = Collections.unmodifiableList(reversed);

        log.info("Configured {} first loss cover(s): {}", covers.size(),
            covers.stream().map(FirstLossCover::getCoverId).toList());
    }

    public List<FirstLossCover> inAbsorptionOrder() {
        return absorptionOrder;
    }

    public List<FirstLossCover> inRecoveryOrder() {
        return recoveryOrder;
    }

    public FirstLossCover get(String coverId) {
        return absorptionOrder.stream()
            .filter(c -> c.getCoverId().equals(coverId))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("First loss cover not found: " + coverId));
    }

    public BigDecimal totalCoverAssets() {
        return absorptionOrder.stream()
            .map(FirstLossCover::getCoverAssets)
            .reduce(Amounts.ZERO, BigDecimal::add);
    }
}
