package com.flagship.mobile_payments.dispatch;

import com.flagship.mobile_payments.config.GatewayClientConfig;
import com.flagship.mobile_payments.gateway.GatewayAcknowledgement;
import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.gateway.GatewayRejectedException;
import com.flagship.mobile_payments.gateway.GatewayUnavailableException;
import com.flagship.mobile_payments.gateway.MobileMoneyGateway;
import com.flagship.mobile_payments.gateway.PushRequest;
import com.flagship.mobile_payments.observability.CorrelationContext;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.reconcile.TransitionService;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import com.flagship.mobile_payments.transaction.TransactionStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Drains QUEUED transactions and sends them to the gateway.
 *
 * Each pass claims a batch in submission order, dispatches the batch on the
 * bounded dispatch pool and waits for all of it before claiming more.
 * Unavailable-gateway errors are retried with exponential backoff; a rejection
 * is final. Nothing a single transaction does can escape the loop.
 */
@Component
@ConditionalOnProperty(name = "dispatch.worker.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DispatchWorker {

    private final TransactionStore store;
    private final MobileMoneyGateway gateway;
    private final TransitionService transitionService;
    private final PaymentMetrics metrics;
    private final Executor dispatchExecutor;
    private final Retry retry;
    private final Clock clock;
    private final int batchSize;
    private final Duration claimTimeout;

    public DispatchWorker(TransactionStore store,
                          MobileMoneyGateway gateway,
                          TransitionService transitionService,
                          PaymentMetrics metrics,
                          @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                          RetryRegistry retryRegistry,
                          Clock clock,
                          @Value("${dispatch.worker.batch-size:20}") int batchSize,
                          @Value("${dispatch.claim-timeout:2m}") Duration claimTimeout) {
        this.store = store;
        this.gateway = gateway;
        this.transitionService = transitionService;
        this.metrics = metrics;
        this.dispatchExecutor = dispatchExecutor;
        this.retry = retryRegistry.retry(GatewayClientConfig.DISPATCH_RETRY);
        this.clock = clock;
        this.batchSize = batchSize;
        this.claimTimeout = claimTimeout;
    }

    @Scheduled(fixedDelayString = "${dispatch.worker.poll-interval-ms:500}")
    public void dispatchPending() {
        CorrelationContext.beginPass();
        try {
            dispatchBatch();
        } catch (Exception e) {
            log.error("Error in dispatch loop", e);
        } finally {
            CorrelationContext.endPass();
        }
    }

    /**
     * Claims and dispatches one batch.
     *
     * @return number of transactions claimed
     */
    public int dispatchBatch() {
        Instant reclaimBefore = clock.instant().minus(claimTimeout);
        List<PaymentTransaction> claimed = store.claimQueued(batchSize, reclaimBefore);
        if (claimed.isEmpty()) {
            return 0;
        }

        log.debug("Dispatching {} queued transactions", claimed.size());
        String correlationId = CorrelationContext.currentCorrelationId();

        CompletableFuture<?>[] futures = claimed.stream()
                .map(transaction -> CompletableFuture.runAsync(
                        () -> dispatchWithCorrelation(transaction, correlationId), dispatchExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();

        return claimed.size();
    }

    private void dispatchWithCorrelation(PaymentTransaction transaction, String correlationId) {
        if (correlationId != null) {
            CorrelationContext.adopt(correlationId);
        }
        try {
            dispatch(transaction);
        } finally {
            CorrelationContext.endPass();
        }
    }

    void dispatch(PaymentTransaction transaction) {
        String checkoutId = transaction.getCheckoutId();
        CorrelationContext.tagCheckout(checkoutId);
        long start = System.nanoTime();
        try {
            boolean stillQueued = store.findByCheckoutId(checkoutId)
                    .map(current -> current.getStatus() == TransactionStatus.QUEUED)
                    .orElse(false);
            if (!stillQueued) {
                log.info("Skipping dispatch of checkoutId={}: no longer queued", checkoutId);
                return;
            }

            PushRequest request = new PushRequest(checkoutId, transaction.getMsisdn(), transaction.getAmount());
            Supplier<GatewayAcknowledgement> push = Retry.decorateSupplier(retry, () -> gateway.initiatePush(request));
            GatewayAcknowledgement acknowledgement = push.get();

            handleAcknowledgement(checkoutId, acknowledgement);
            metrics.recordDispatch(resultTag(acknowledgement.getOutcome()), elapsedSince(start));

        } catch (GatewayUnavailableException e) {
            String detail = String.format("gateway unavailable after %d attempts: %s",
                    retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            log.warn("Dispatch of checkoutId={} failed: {}", checkoutId, detail);
            failSafely(checkoutId, TransactionStatus.ERROR, detail);
            metrics.recordDispatch("unavailable", elapsedSince(start));

        } catch (GatewayRejectedException e) {
            log.warn("Gateway rejected checkoutId={}: {}", checkoutId, e.getMessage());
            failSafely(checkoutId, TransactionStatus.ERROR, "gateway rejected request: " + e.getMessage());
            metrics.recordDispatch("rejected", elapsedSince(start));

        } catch (Exception e) {
            log.error("Unexpected error dispatching checkoutId={}", checkoutId, e);
            failSafely(checkoutId, TransactionStatus.ERROR, "dispatch failed: " + e.getMessage());
            metrics.recordDispatch("error", elapsedSince(start));

        } finally {
            CorrelationContext.untagCheckout();
        }
    }

    private void handleAcknowledgement(String checkoutId, GatewayAcknowledgement acknowledgement) {
        switch (acknowledgement.getOutcome()) {
            case PENDING -> {
                transitionService.markProcessing(checkoutId, acknowledgement.getRemoteCheckoutId());
                log.info("Gateway accepted checkoutId={} as {}", checkoutId, acknowledgement.getRemoteCheckoutId());
            }
            case COMPLETED -> {
                // Already paid: record the acceptance, then complete through the normal credit path.
                transitionService.markProcessing(checkoutId, acknowledgement.getRemoteCheckoutId())
                        .ifPresent(processing -> transitionService.apply(checkoutId, GatewayOutcome.COMPLETED,
                                acknowledgement.getReference(), acknowledgement.getMessage()));
            }
            case FAILED -> {
                log.info("Gateway declined checkoutId={}: {}", checkoutId, acknowledgement.getMessage());
                transitionService.markDispatchFailed(checkoutId, TransactionStatus.FAILED, acknowledgement.getMessage());
            }
            default -> transitionService.markDispatchFailed(checkoutId, TransactionStatus.ERROR,
                    "unexpected gateway acknowledgement: " + acknowledgement.getOutcome());
        }
    }

    private void failSafely(String checkoutId, TransactionStatus target, String detail) {
        try {
            transitionService.markDispatchFailed(checkoutId, target, detail);
        } catch (Exception e) {
            log.error("Could not record dispatch failure for checkoutId={}; the sweeper will close it", checkoutId, e);
        }
    }

    private static String resultTag(GatewayOutcome outcome) {
        return switch (outcome) {
            case PENDING -> "accepted";
            case COMPLETED -> "completed";
            case FAILED -> "failed";
            default -> "error";
        };
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
