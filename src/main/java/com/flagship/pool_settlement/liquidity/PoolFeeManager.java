package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.InsufficientLiquidityException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

/**
 * Takes protocol, pool owner and evaluation agent fees off profit before it
 * reaches covers and tranches, and holds the accrued fees until withdrawn.
 */
@Slf4j
@Service
public class PoolFeeManager {

    private final String poolName;
    private final LedgerService ledgerService;
    private final PoolFeeRepository feeRepository;
    private final TransactionTemplate transactionTemplate;

    public PoolFeeManager(PoolProperties properties, LedgerService ledgerService, PoolFeeRepository feeRepository,
                          TransactionTemplate transactionTemplate) {
        this.poolName = properties.getName();
        this.ledgerService = ledgerService;
        this.feeRepository = feeRepository;
        this.transactionTemplate = transactionTemplate;

        transactionTemplate.executeWithoutResult(status -> {
            feeRepository.initialize(poolName, FeeSchedule.from(properties.getFees()));
            for (FeeRecipient recipient : FeeRecipient.values()) {
                ledgerService.openAccount(recipient.getFeeAccount(), Account.AccountType.INTERNAL);
                ledgerService.openAccount(recipient.getTreasuryAccount(), Account.AccountType.EXTERNAL);
            }
        });
    }

    public PoolFeeDistribution calcPoolFees(BigDecimal profit) {
        FeeSchedule schedule = getFeeSchedule();
        BigDecimal flat = Amounts.min(Amounts.scale(schedule.getFlatFee()), profit);
        BigDecimal afterFlat = profit.subtract(flat);
        BigDecimal protocolFee = Amounts.bps(afterFlat, schedule.getProtocolFeeBps());
        BigDecimal remaining = afterFlat.subtract(protocolFee);
        BigDecimal poolOwnerFee = Amounts.bps(remaining, schedule.getPoolOwnerRewardBps());
        BigDecimal eaFee = Amounts.bps(remaining, schedule.getEaRewardBps());
        BigDecimal net = remaining.subtract(poolOwnerFee).subtract(eaFee);
        return new PoolFeeDistribution(flat.add(protocolFee), poolOwnerFee, eaFee, net);
    }

    /**
     * Moves the fee cut of a profit from the pool safe into the fee accounts.
     *
     * @return the fee split, whose netProfit is what remains for covers and tranches
     */
    public PoolFeeDistribution distributePoolFees(BigDecimal profit) {
        return transactionTemplate.execute(status -> {
            PoolFeeDistribution distribution = calcPoolFees(profit);
            for (FeeRecipient recipient : FeeRecipient.values()) {
                BigDecimal fee = distribution.get(recipient);
                if (fee.signum() > 0) {
                    ledgerService.transfer(CustodyAccounts.POOL_SAFE, recipient.getFeeAccount(), fee,
                        "Pool fee: " + recipient);
                    feeRepository.addAccrued(recipient, fee);
                }
            }
            log.debug("Pool fees on profit {}: protocol={}, poolOwner={}, ea={}, net={}", profit,
                distribution.getProtocolFee(), distribution.getPoolOwnerFee(), distribution.getEaFee(),
                distribution.getNetProfit());
            return distribution;
        });
    }

    public BigDecimal withdrawProtocolFee(BigDecimal amount) {
        return withdraw(FeeRecipient.PROTOCOL, amount);
    }

    public BigDecimal withdrawPoolOwnerFee(BigDecimal amount) {
        return withdraw(FeeRecipient.POOL_OWNER, amount);
    }

    public BigDecimal withdrawEaFee(BigDecimal amount) {
        return withdraw(FeeRecipient.EVALUATION_AGENT, amount);
    }

    /**
     * @throws InsufficientLiquidityException if more than the accrued, unwithdrawn fee is requested
     */
    public BigDecimal withdraw(FeeRecipient recipient, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        return transactionTemplate.execute(status -> {
            BigDecimal available = withdrawable(recipient);
            if (value.compareTo(available) > 0) {
                throw new InsufficientLiquidityException(String.format(
                    "%s fee withdrawable is %s, requested %s", recipient, available, value));
            }
            ledgerService.transfer(recipient.getFeeAccount(), recipient.getTreasuryAccount(), value,
                "Fee withdrawal: " + recipient);
            log.info("Withdrew {} of {} fees", value, recipient);
            return value;
        });
    }

    public FeeSchedule updateFeeSchedule(FeeSchedule newSchedule) {
        newSchedule.validate();
        return transactionTemplate.execute(status -> {
            FeeSchedule previous = getFeeSchedule();
            feeRepository.saveSchedule(poolName, newSchedule);
            log.info("Fee schedule updated: {} -> {}", previous, newSchedule);
            return newSchedule;
        });
    }

    public FeeSchedule getFeeSchedule() {
        return feeRepository.findSchedule(poolName);
    }

    public BigDecimal withdrawable(FeeRecipient recipient) {
        return ledgerService.getAccountBalance(recipient.getFeeAccount());
    }

    public BigDecimal getTotalAccrued(FeeRecipient recipient) {
        return feeRepository.getTotalAccrued(recipient);
    }
}
