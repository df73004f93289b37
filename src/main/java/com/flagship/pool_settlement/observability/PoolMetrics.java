package com.flagship.pool_settlement.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Centralized metrics for pool operations.
 *
 * Metrics exposed:
 * - pool.profit.distributed / pool.loss.distributed / pool.loss.recovered: amount summaries
 * - pool.loss.shortfall: losses no tranche or cover could absorb
 * - credit.drawdown / credit.payment: amount summaries tagged by credit type
 * - credit.state.transition: counter tagged by target state
 * - redemption.requested: counter tagged by tranche
 * - epoch.close.duration: timer for epoch settlement
 * - pool.total.value / pool.tranche.assets: gauges registered by the pool
 */
@Component
public class PoolMetrics {

    private final MeterRegistry registry;

    private final Counter epochsClosed;
    private final Timer epochCloseTimer;

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.epochsClosed = Counter.builder("epoch.closed")
                .description("Number of redemption epochs closed")
                .register(registry);

        this.epochCloseTimer = Timer.builder("epoch.close.duration")
                .description("Time taken to settle a redemption epoch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Pool Accounting ====================

    public void recordProfitDistributed(BigDecimal amount) {
        registry.summary("pool.profit.distributed").record(amount.doubleValue());
    }

    public void recordLossDistributed(BigDecimal amount) {
        registry.summary("pool.loss.distributed").record(amount.doubleValue());
    }

    public void recordLossRecovered(BigDecimal amount) {
        registry.summary("pool.loss.recovered").record(amount.doubleValue());
    }

    public void recordShortfall(BigDecimal amount) {
        registry.counter("pool.loss.shortfall").increment(amount.doubleValue());
    }

    // ==================== Credit ====================

    public void recordDrawdown(String creditType, BigDecimal amount) {
        registry.summary("credit.drawdown", "credit_type", sanitizeTag(creditType))
                .record(amount.doubleValue());
    }

    public void recordPayment(String creditType, BigDecimal amount) {
        registry.summary("credit.payment", "credit_type", sanitizeTag(creditType))
                .record(amount.doubleValue());
    }

    public void recordCreditStateTransition(String state) {
        registry.counter("credit.state.transition", "state", sanitizeTag(state)).increment();
    }

    // ==================== Redemption ====================

    public void recordRedemptionRequested(String tranche) {
        registry.counter("redemption.requested", "tranche", sanitizeTag(tranche)).increment();
    }

    public void recordRedemptionDisbursed(String tranche, BigDecimal amount) {
        registry.summary("redemption.disbursed", "tranche", sanitizeTag(tranche))
                .record(amount.doubleValue());
    }

    public <T> T timeEpochClose(Supplier<T> operation) {
        T result = epochCloseTimer.record(operation);
        epochsClosed.increment();
        return result;
    }

    // ==================== Gauges ====================

    public void registerPoolValueGauge(Supplier<BigDecimal> supplier) {
        Gauge.builder("pool.total.value", supplier, s -> s.get().doubleValue())
                .strongReference(true)
                .register(registry);
    }

    public void registerTrancheAssetsGauge(String tranche, Supplier<BigDecimal> supplier) {
        Gauge.builder("pool.tranche.assets", supplier, s -> s.get().doubleValue())
                .tags(Tags.of("tranche", sanitizeTag(tranche)))
                .strongReference(true)
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
