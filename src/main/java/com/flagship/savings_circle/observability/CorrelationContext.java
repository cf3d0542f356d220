package com.flagship.savings_circle.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread correlation id plus the MDC keys the settlement path logs under.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String REFERENCE_MDC_KEY = "reference";
    public static final String GROUP_ID_MDC_KEY = "groupId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for log readability.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags subsequent log lines on this thread with a payment reference.
     * Callers remove it with {@link #clearPaymentContext()}.
     */
    public static void putReference(String reference) {
        if (reference != null) {
            MDC.put(REFERENCE_MDC_KEY, reference);
        }
    }

    public static void putGroupId(UUID groupId) {
        if (groupId != null) {
            MDC.put(GROUP_ID_MDC_KEY, groupId.toString());
        }
    }

    public static void clearPaymentContext() {
        MDC.remove(REFERENCE_MDC_KEY);
        MDC.remove(GROUP_ID_MDC_KEY);
    }
}
