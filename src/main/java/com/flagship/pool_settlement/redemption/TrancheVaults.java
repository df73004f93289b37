package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.event.EventJournal;
import com.flagship.pool_settlement.ledger.LedgerService;
import com.flagship.pool_settlement.liquidity.Pool;
import com.flagship.pool_settlement.liquidity.Tranche;
import com.flagship.pool_settlement.observability.PoolMetrics;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The senior and junior vaults of the pool.
 */
@Component
public class TrancheVaults {

    public static final long FIRST_EPOCH_ID = 1L;

    private final Map<Tranche, TrancheVault> vaults = new EnumMap<>(Tranche.class);

    public TrancheVaults(Pool pool,
                         LedgerService ledgerService,
                         TrancheVaultRepository repository,
                         TransactionTemplate transactionTemplate,
                         EventJournal eventJournal,
                         PoolMetrics metrics,
                         Clock clock) {
        for (Tranche tranche : Tranche.values()) {
            vaults.put(tranche, new TrancheVault(tranche, pool, ledgerService, repository, transactionTemplate,
                eventJournal, metrics, clock, FIRST_EPOCH_ID));
        }
    }

    public TrancheVault get(Tranche tranche) {
        return vaults.get(tranche);
    }

    public TrancheVault senior() {
        return vaults.get(Tranche.SENIOR);
    }

    public TrancheVault junior() {
        return vaults.get(Tranche.JUNIOR);
    }

    public Collection<TrancheVault> all() {
        return Collections.unmodifiableCollection(vaults.values());
    }
}
