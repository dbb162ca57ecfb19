package com.flagship.mobile_payments.sweeper;

import com.flagship.mobile_payments.observability.CorrelationContext;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.reconcile.TransitionService;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes transactions that stayed non-terminal longer than the processing
 * threshold. Transactions with a credit in flight are left alone: the
 * payment is confirmed and the credit recovery pass owns them.
 */
@Component
@ConditionalOnProperty(name = "sweeper.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TimeoutSweeper {

    static final String TIMEOUT_DETAIL = "exceeded maximum processing time";

    private final TransactionStore store;
    private final TransitionService transitionService;
    private final PaymentMetrics metrics;
    private final Clock clock;
    private final Duration threshold;
    private final int batchSize;

    public TimeoutSweeper(TransactionStore store,
                          TransitionService transitionService,
                          PaymentMetrics metrics,
                          Clock clock,
                          @Value("${sweeper.threshold:5m}") Duration threshold,
                          @Value("${sweeper.batch-size:100}") int batchSize) {
        this.store = store;
        this.transitionService = transitionService;
        this.metrics = metrics;
        this.clock = clock;
        this.threshold = threshold;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${sweeper.interval-ms:30000}")
    public void sweep() {
        sweepOnce();
    }

    /**
     * @return number of transactions moved to TIMEOUT
     */
    public int sweepOnce() {
        CorrelationContext.beginPass();
        try {
            Instant cutoff = clock.instant().minus(threshold);
            List<PaymentTransaction> stale = store.findStale(cutoff, batchSize);

            int timedOut = 0;
            for (PaymentTransaction transaction : stale) {
                if (timeOut(transaction)) {
                    timedOut++;
                }
            }
            if (timedOut > 0) {
                log.info("Timed out {} transactions created before {}", timedOut, cutoff);
            }
            return timedOut;
        } catch (Exception e) {
            log.error("Error in timeout sweeper loop", e);
            return 0;
        } finally {
            CorrelationContext.endPass();
        }
    }

    private boolean timeOut(PaymentTransaction transaction) {
        try {
            boolean moved = transitionService.timeout(transaction.getCheckoutId(), TIMEOUT_DETAIL);
            if (moved) {
                metrics.incrementTimeouts();
                log.info("Transaction {} timed out in {} status", transaction.getCheckoutId(), transaction.getStatus());
            }
            return moved;
        } catch (Exception e) {
            log.error("Failed to time out transaction {}", transaction.getCheckoutId(), e);
            return false;
        }
    }
}
