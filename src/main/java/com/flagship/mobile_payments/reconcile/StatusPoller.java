package com.flagship.mobile_payments.reconcile;

import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.gateway.GatewayRejectedException;
import com.flagship.mobile_payments.gateway.GatewayStatus;
import com.flagship.mobile_payments.gateway.GatewayUnavailableException;
import com.flagship.mobile_payments.gateway.MobileMoneyGateway;
import com.flagship.mobile_payments.observability.CorrelationContext;
import com.flagship.mobile_payments.observability.PaymentMetrics;
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
import java.util.Locale;

/**
 * Active reconciliation channel: asks the gateway about transactions it
 * accepted but has not resolved within the grace period, in case the
 * callback never arrives.
 *
 * An unreachable gateway is skipped until the next pass; an answer that
 * cannot be interpreted closes the transaction as ERROR.
 */
@Component
@ConditionalOnProperty(name = "reconciler.poll.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class StatusPoller {

    private final TransactionStore store;
    private final MobileMoneyGateway gateway;
    private final TransitionService transitionService;
    private final PaymentMetrics metrics;
    private final Clock clock;
    private final Duration gracePeriod;
    private final int batchSize;

    public StatusPoller(TransactionStore store,
                        MobileMoneyGateway gateway,
                        TransitionService transitionService,
                        PaymentMetrics metrics,
                        Clock clock,
                        @Value("${reconciler.poll.grace-period:30s}") Duration gracePeriod,
                        @Value("${reconciler.poll.batch-size:50}") int batchSize) {
        this.store = store;
        this.gateway = gateway;
        this.transitionService = transitionService;
        this.metrics = metrics;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${reconciler.poll.interval-ms:10000}")
    public void pollAwaiting() {
        CorrelationContext.beginPass();
        try {
            Instant updatedBefore = clock.instant().minus(gracePeriod);
            List<PaymentTransaction> awaiting = store.findAwaitingGateway(updatedBefore, batchSize);
            if (!awaiting.isEmpty()) {
                log.debug("Polling gateway for {} unresolved transactions", awaiting.size());
            }
            awaiting.forEach(this::poll);
        } catch (Exception e) {
            log.error("Error in status poll loop", e);
        } finally {
            CorrelationContext.endPass();
        }
    }

    void poll(PaymentTransaction transaction) {
        String checkoutId = transaction.getCheckoutId();
        CorrelationContext.tagCheckout(checkoutId);
        try {
            GatewayStatus status = gateway.queryStatus(transaction.getRemoteCheckoutId());
            TransitionResult result = transitionService.apply(
                    checkoutId, status.getOutcome(), status.getReference(), status.getMessage());
            metrics.recordPoll(status.getOutcome().name().toLowerCase(Locale.ROOT));
            log.debug("Poll of checkoutId={} returned {}: {}", checkoutId, status.getOutcome(), result);
        } catch (GatewayUnavailableException e) {
            metrics.recordPoll("unavailable");
            log.warn("Gateway unavailable while polling checkoutId={}: {}", checkoutId, e.getMessage());
        } catch (GatewayRejectedException e) {
            metrics.recordPoll("rejected");
            log.warn("Gateway status for checkoutId={} unusable: {}", checkoutId, e.getMessage());
            closeAsErrorSafely(checkoutId, "malformed gateway status response: " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to poll checkoutId={}", checkoutId, e);
        } finally {
            CorrelationContext.untagCheckout();
        }
    }

    private void closeAsErrorSafely(String checkoutId, String detail) {
        try {
            transitionService.apply(checkoutId, GatewayOutcome.ERROR, null, detail);
        } catch (Exception e) {
            log.error("Could not record unusable status for checkoutId={}; the next poll retries it", checkoutId, e);
        }
    }
}
