package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background refresh of every credit's bill, so late fees and defaults are
 * applied even when no borrower touches the credit.
 */
@Component
@ConditionalOnProperty(name = "pool.scheduler.billing-refresh-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BillingRefreshScheduler {

    private final CreditManager creditManager;

    @Scheduled(fixedDelayString = "${pool.scheduler.billing-refresh-interval-ms:3600000}")
    public void refreshBills() {
        CorrelationContext.beginBackgroundScope("billing");
        try {
            int refreshed = creditManager.refreshAll();
            log.info("Billing refresh completed for {} credit(s)", refreshed);
        } catch (Exception e) {
            log.error("Error in billing refresh run", e);
        } finally {
            CorrelationContext.endBackgroundScope();
        }
    }
}
