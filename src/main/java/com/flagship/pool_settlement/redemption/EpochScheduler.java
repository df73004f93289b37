package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.exception.PoolException;
import com.flagship.pool_settlement.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Closes the current epoch once its end date has passed.
 */
@Component
@ConditionalOnProperty(name = "pool.scheduler.epoch-close-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EpochScheduler {

    private final EpochManager epochManager;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pool.scheduler.epoch-check-interval-ms:60000}")
    public void closeEndedEpoch() {
        Epoch epoch = epochManager.currentEpoch();
        if (!epoch.hasEnded(LocalDate.now(clock))) {
            return;
        }
        CorrelationContext.beginBackgroundScope("epoch");
        try {
            EpochCloseResult result = epochManager.closeEpoch();
            log.info("Scheduled close of epoch {} done, next epoch {}", result.getClosedEpochId(),
                result.getNextEpoch().getId());
        } catch (PoolException e) {
            log.warn("Scheduled close of epoch {} rejected [{}]: {}", epoch.getId(), e.getErrorCode(),
                e.getMessage());
        } catch (Exception e) {
            log.error("Error closing epoch {}", epoch.getId(), e);
        } finally {
            CorrelationContext.endBackgroundScope();
        }
    }
}
