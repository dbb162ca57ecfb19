package com.flagship.mobile_payments.observability;

import com.flagship.mobile_payments.transaction.TransactionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the payment engine.
 *
 * Metrics exposed:
 * - payment.enqueued / payment.duplicate_requests / payment.invalid_requests
 * - payment.transitions{from,to}: every committed status change
 * - payment.dispatch{result}, payment.dispatch.duration
 * - payment.credit{result}
 * - payment.callbacks{result}, payment.polls{result}
 * - payment.timeouts
 * - payment.api.duration{endpoint,method,status}
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    private final Counter paymentsEnqueued;
    private final Counter duplicateRequests;
    private final Counter invalidRequests;
    private final Counter timeouts;

    private final Timer dispatchTimer;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentsEnqueued = Counter.builder("payment.enqueued")
                .description("Number of payment intents accepted into the queue")
                .register(registry);

        this.duplicateRequests = Counter.builder("payment.duplicate_requests")
                .description("Number of payment intents rejected as duplicates")
                .register(registry);

        this.invalidRequests = Counter.builder("payment.invalid_requests")
                .description("Number of payment intents rejected by validation")
                .register(registry);

        this.timeouts = Counter.builder("payment.timeouts")
                .description("Number of transactions closed by the timeout sweeper")
                .register(registry);

        this.dispatchTimer = Timer.builder("payment.dispatch.duration")
                .description("Time taken to dispatch a transaction to the gateway, retries included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void incrementEnqueued() {
        paymentsEnqueued.increment();
    }

    public void incrementDuplicateRequests() {
        duplicateRequests.increment();
    }

    public void incrementInvalidRequests() {
        invalidRequests.increment();
    }

    public void incrementTimeouts() {
        timeouts.increment();
    }

    public void recordTransition(TransactionStatus from, TransactionStatus to) {
        registry.counter("payment.transitions",
                "from", from.wireName(),
                "to", to.wireName()
        ).increment();
    }

    /**
     * @param result accepted, completed, failed, rejected or unavailable
     */
    public void recordDispatch(String result, Duration duration) {
        registry.counter("payment.dispatch", "result", sanitizeTag(result)).increment();
        dispatchTimer.record(duration);
    }

    /**
     * @param result credited, failed or exhausted
     */
    public void recordCredit(String result) {
        registry.counter("payment.credit", "result", sanitizeTag(result)).increment();
    }

    /**
     * @param result applied, ignored or unknown
     */
    public void recordCallback(String result) {
        registry.counter("payment.callbacks", "result", sanitizeTag(result)).increment();
    }

    public void recordPoll(String result) {
        registry.counter("payment.polls", "result", sanitizeTag(result)).increment();
    }

    public void recordDedupCache(boolean hit) {
        registry.counter("dedup.cache", "result", hit ? "hit" : "miss").increment();
    }

    public void recordApiDuration(String endpoint, String method, int statusCode, Duration duration) {
        Timer.builder("payment.api.duration")
                .tag("endpoint", endpoint)
                .tag("method", method)
                .tag("status", String.valueOf(statusCode))
                .register(registry)
                .record(duration);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
