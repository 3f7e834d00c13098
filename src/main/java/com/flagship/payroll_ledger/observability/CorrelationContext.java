package com.flagship.payroll_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the ledger logs under.
 *
 * The correlation id comes from the X-Correlation-ID request header or is
 * generated, and appears in every log line of the request through MDC.
 * {@code employeeId} and {@code paymentId} are set by the ledger engine
 * while it works on a specific employee or payment.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EMPLOYEE_ID_MDC_KEY = "employeeId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * @return the current correlation id, generating one if none is set
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
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * First eight characters of a random UUID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
