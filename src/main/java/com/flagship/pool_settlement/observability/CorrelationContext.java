package com.flagship.pool_settlement.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through HTTP requests (from header or generated),
 * scheduler runs, and every log statement via MDC. Operation scoped keys
 * (credit, lender, epoch) are put next to it by the services handling them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CREDIT_ID_MDC_KEY = "creditId";
    public static final String LENDER_MDC_KEY = "lender";
    public static final String EPOCH_ID_MDC_KEY = "epochId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Puts an operation scoped key into MDC. Closing the handle restores the
     * previous value, so nested operations on the same key are safe.
     */
    public static MdcScope scoped(String key, Object value) {
        String previous = MDC.get(key);
        MDC.put(key, String.valueOf(value));
        return () -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        };
    }

    public interface MdcScope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Starts a correlation scope for background work (schedulers) that has no request header.
     */
    public static void beginBackgroundScope(String prefix) {
        String id = prefix + "-" + generateCorrelationId();
        setCorrelationId(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
    }

    public static void endBackgroundScope() {
        clear();
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }
}
