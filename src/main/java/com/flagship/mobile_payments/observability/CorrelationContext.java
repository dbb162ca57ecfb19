package com.flagship.mobile_payments.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation and checkout ids carried in the logging MDC.
 *
 * HTTP requests take the correlation id from the X-Correlation-ID header,
 * falling back to a generated one. Background loops open a pass per run with
 * {@link #beginPass()}, and tag each transaction they touch with
 * {@link #tagCheckout(String)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CHECKOUT_ID_MDC_KEY = "checkoutId";

    private static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Uses the inbound id when it is usable, otherwise generates one.
     * Returns the id now in the MDC.
     */
    public static String adopt(String inboundId) {
        String id = isUsable(inboundId) ? inboundId.trim() : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Starts a background pass with a fresh correlation id.
     */
    public static String beginPass() {
        return adopt(null);
    }

    public static void endPass() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CHECKOUT_ID_MDC_KEY);
    }

    public static void tagCheckout(String checkoutId) {
        MDC.put(CHECKOUT_ID_MDC_KEY, checkoutId);
    }

    public static void untagCheckout() {
        MDC.remove(CHECKOUT_ID_MDC_KEY);
    }

    /**
     * Short id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    // Header values end up in every log line; keep them short and printable.
    private static boolean isUsable(String id) {
        if (id == null || id.isBlank() || id.length() > MAX_INBOUND_LENGTH) {
            return false;
        }
        return id.trim().chars().allMatch(c -> c > 0x20 && c < 0x7f);
    }
}
