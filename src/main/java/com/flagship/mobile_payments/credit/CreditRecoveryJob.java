package com.flagship.mobile_payments.credit;

import com.flagship.mobile_payments.observability.CorrelationContext;
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
 * Retries balance credits for payments the gateway confirmed but the hook
 * never acknowledged: credits that failed, and credits left ATTEMPTING by a
 * crash mid-call.
 */
@Component
@ConditionalOnProperty(name = "credit.recovery.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class CreditRecoveryJob {

    private final TransactionStore store;
    private final TransitionService transitionService;
    private final Clock clock;
    private final Duration staleAfter;
    private final int batchSize;

    public CreditRecoveryJob(TransactionStore store,
                             TransitionService transitionService,
                             Clock clock,
                             @Value("${credit.recovery.stale-after:2m}") Duration staleAfter,
                             @Value("${credit.recovery.batch-size:50}") int batchSize) {
        this.store = store;
        this.transitionService = transitionService;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${credit.recovery.interval-ms:30000}")
    public void recoverCredits() {
        CorrelationContext.beginPass();
        try {
            Instant staleBefore = clock.instant().minus(staleAfter);
            List<PaymentTransaction> incomplete = store.findIncompleteCredits(staleBefore, batchSize);
            if (!incomplete.isEmpty()) {
                log.info("Retrying {} incomplete credits", incomplete.size());
            }
            for (PaymentTransaction transaction : incomplete) {
                retry(transaction, staleBefore);
            }
        } catch (Exception e) {
            log.error("Error in credit recovery loop", e);
        } finally {
            CorrelationContext.endPass();
        }
    }

    private void retry(PaymentTransaction transaction, Instant staleBefore) {
        CorrelationContext.tagCheckout(transaction.getCheckoutId());
        try {
            transitionService.retryCredit(transaction.getCheckoutId(), staleBefore);
        } catch (Exception e) {
            log.error("Credit retry failed for checkoutId={}", transaction.getCheckoutId(), e);
        } finally {
            CorrelationContext.untagCheckout();
        }
    }
}
