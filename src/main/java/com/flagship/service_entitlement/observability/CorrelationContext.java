package com.flagship.service_entitlement.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID and MDC keys shared by the HTTP filter, services and consumers.
 *
 * The correlation ID lives in MDC for the duration of a request or consumed
 * record; services add the student / contract / hold they are working on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String STUDENT_ID_MDC_KEY = "studentId";
    public static final String CONTRACT_ID_MDC_KEY = "contractId";
    public static final String HOLD_ID_MDC_KEY = "holdId";

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_MDC_KEY,
                correlationId == null || correlationId.isBlank() ? generateCorrelationId() : correlationId);
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Puts {@code value} under {@code key} when non-null. Pair with {@link #clear(String...)}.
     */
    public static void put(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    public static void clear(String... keys) {
        for (String key : keys) {
            MDC.remove(key);
        }
    }

    public static void clearAll() {
        clear(CORRELATION_ID_MDC_KEY, STUDENT_ID_MDC_KEY, CONTRACT_ID_MDC_KEY, HOLD_ID_MDC_KEY);
    }
}
