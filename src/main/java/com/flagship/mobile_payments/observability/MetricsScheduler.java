package com.flagship.mobile_payments.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges (outbox backlog, dispatch queue depth)
 * between scrapes.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    @Scheduled(initialDelayString = "${metrics.refresh.initial-delay-ms:5000}",
            fixedRateString = "${metrics.refresh.interval-ms:15000}")
    public void refreshGauges() {
        CorrelationContext.beginPass();
        try {
            outboxMetrics.refreshMetrics();
        } finally {
            CorrelationContext.endPass();
        }
    }
}
