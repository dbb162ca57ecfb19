package com.flagship.mobile_payments.reconcile;

import com.flagship.mobile_payments.credit.BalanceCreditHook;
import com.flagship.mobile_payments.credit.CreditRequest;
import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.exception.TransactionAlreadyTerminalException;
import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;
import com.flagship.mobile_payments.transaction.CreditState;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * The single place where transaction status changes are decided.
 *
 * Callbacks, polls, the dispatch worker, client cancels, the sweeper and the
 * credit recovery pass all come through here, and every change is a
 * compare-and-set against the stored record. Whoever commits first wins; the
 * others see a predicate that no longer holds and become no-ops.
 *
 * COMPLETED is reached in two steps: the credit attempt is recorded first
 * (credit state ATTEMPTING), then the hook is called, then the record is
 * completed. While a credit is in flight no other outcome can close the record.
 */
@Service
@Slf4j
public class TransitionService {

    static final String CANCELLED_BY_CLIENT = "cancelled by client";

    private final TransactionStore store;
    private final BalanceCreditHook creditHook;
    private final PaymentMetrics metrics;
    private final int creditMaxAttempts;
    private final Clock clock;

    public TransitionService(TransactionStore store,
                             BalanceCreditHook creditHook,
                             PaymentMetrics metrics,
                             @Value("${credit.max-attempts:5}") int creditMaxAttempts,
                             Clock clock) {
        this.store = store;
        this.creditHook = creditHook;
        this.metrics = metrics;
        this.creditMaxAttempts = creditMaxAttempts;
        this.clock = clock;
    }

    /**
     * Applies a gateway outcome to a transaction identified by its local checkout id.
     */
    public TransitionResult apply(String checkoutId, GatewayOutcome outcome, String reference, String message) {
        return switch (outcome) {
            case COMPLETED -> complete(checkoutId, reference);
            case PENDING -> transition(checkoutId,
                    t -> t.getStatus() == TransactionStatus.PROCESSING && t.getCreditState() == CreditState.NONE,
                    t -> t.transitionTo(TransactionStatus.PENDING, null, clock.instant()))
                    .map(t -> TransitionResult.APPLIED)
                    .orElse(TransitionResult.NO_OP);
            case FAILED, CANCELLED, ERROR -> close(checkoutId, outcome.targetStatus(), detailFor(outcome, message));
        };
    }

    /**
     * QUEUED -> PROCESSING after the gateway accepted the push.
     */
    public Optional<PaymentTransaction> markProcessing(String checkoutId, String remoteCheckoutId) {
        Optional<PaymentTransaction> result = transition(checkoutId,
                t -> t.getStatus() == TransactionStatus.QUEUED,
                t -> t.acceptedByGateway(remoteCheckoutId, clock.instant()));
        if (result.isEmpty()) {
            log.warn("Gateway accepted checkoutId={} (remote {}) but it is no longer queued",
                    checkoutId, remoteCheckoutId);
        }
        return result;
    }

    /**
     * Closes a transaction that never left the queue because dispatch failed.
     */
    public Optional<PaymentTransaction> markDispatchFailed(String checkoutId, TransactionStatus target, String detail) {
        return transition(checkoutId,
                t -> t.getStatus() == TransactionStatus.QUEUED,
                t -> t.transitionTo(target, detail, clock.instant()));
    }

    /**
     * Client-initiated cancel.
     *
     * @throws TransactionNotFoundException if the checkout id is unknown
     * @throws TransactionAlreadyTerminalException if the transaction is already terminal
     * @throws IllegalStateException if the payment is confirmed and its credit is in flight
     */
    public PaymentTransaction cancel(String checkoutId) {
        Optional<PaymentTransaction> cancelled = transition(checkoutId,
                t -> !t.isTerminal() && !t.isCreditInFlight(),
                t -> t.transitionTo(TransactionStatus.CANCELLED, CANCELLED_BY_CLIENT, clock.instant()));
        if (cancelled.isPresent()) {
            log.info("Transaction {} cancelled by client", checkoutId);
            return cancelled.get();
        }

        PaymentTransaction latest = store.findByCheckoutId(checkoutId)
                .orElseThrow(() -> new TransactionNotFoundException(checkoutId));
        if (latest.isTerminal()) {
            throw new TransactionAlreadyTerminalException(checkoutId, latest.getStatus());
        }
        throw new IllegalStateException(
                "Transaction " + checkoutId + " is confirmed and being credited; it can no longer be cancelled");
    }

    /**
     * Moves a stuck transaction to TIMEOUT unless it became terminal or a
     * credit started in the meantime.
     */
    public boolean timeout(String checkoutId, String detail) {
        return transition(checkoutId,
                t -> !t.isTerminal() && t.getCreditState() == CreditState.NONE,
                t -> t.transitionTo(TransactionStatus.TIMEOUT, detail, clock.instant()))
                .isPresent();
    }

    /**
     * Retries a credit that failed, or that has been ATTEMPTING since before
     * staleBefore (the process died during the hook call).
     */
    public TransitionResult retryCredit(String checkoutId, Instant staleBefore) {
        Optional<PaymentTransaction> started = store.compareAndSet(checkoutId,
                t -> !t.isTerminal() && isRetryableCredit(t, staleBefore),
                t -> t.beginCredit(null, clock.instant()));
        if (started.isEmpty()) {
            return TransitionResult.NO_OP;
        }
        log.info("Retrying credit for checkoutId={} (attempt {} of {})",
                checkoutId, started.get().getCreditAttempts(), creditMaxAttempts);
        return runCredit(started.get());
    }

    private boolean isRetryableCredit(PaymentTransaction t, Instant staleBefore) {
        if (t.getCreditState() == CreditState.FAILED) {
            return true;
        }
        return t.getCreditState() == CreditState.ATTEMPTING
                && t.getCreditAttemptedAt() != null
                && t.getCreditAttemptedAt().isBefore(staleBefore);
    }

    private TransitionResult complete(String checkoutId, String reference) {
        Optional<PaymentTransaction> started = store.compareAndSet(checkoutId,
                t -> (t.getStatus() == TransactionStatus.PROCESSING || t.getStatus() == TransactionStatus.PENDING)
                        && t.getCreditState() == CreditState.NONE,
                t -> t.beginCredit(reference, clock.instant()));
        if (started.isEmpty()) {
            log.debug("Completion for checkoutId={} ignored: already resolved or credit in flight", checkoutId);
            return TransitionResult.NO_OP;
        }
        return runCredit(started.get());
    }

    private TransitionResult runCredit(PaymentTransaction attempting) {
        String checkoutId = attempting.getCheckoutId();
        try {
            creditHook.credit(CreditRequest.of(attempting));
        } catch (RuntimeException e) {
            return recordCreditFailure(attempting, e.getMessage());
        }

        Optional<PaymentTransaction> completed = transition(checkoutId,
                t -> t.getCreditState() == CreditState.ATTEMPTING && !t.isTerminal(),
                t -> t.creditSucceeded(clock.instant()));
        if (completed.isEmpty()) {
            // A concurrent recovery pass finished the same credit first.
            return TransitionResult.NO_OP;
        }
        metrics.recordCredit("credited");
        log.info("Transaction {} completed with reference {}", checkoutId, completed.get().getReference());
        return TransitionResult.APPLIED;
    }

    private TransitionResult recordCreditFailure(PaymentTransaction attempting, String reason) {
        String checkoutId = attempting.getCheckoutId();

        if (attempting.getCreditAttempts() >= creditMaxAttempts) {
            String detail = String.format("credit failed after %d attempts: %s", attempting.getCreditAttempts(), reason);
            transition(checkoutId,
                    t -> t.getCreditState() == CreditState.ATTEMPTING && !t.isTerminal(),
                    t -> t.creditExhausted(detail, clock.instant()));
            metrics.recordCredit("exhausted");
            log.error("Credit budget exhausted for checkoutId={}: {}", checkoutId, reason);
            return TransitionResult.CREDIT_FAILED;
        }

        store.compareAndSet(checkoutId,
                t -> t.getCreditState() == CreditState.ATTEMPTING && !t.isTerminal(),
                t -> t.creditFailed("credit failed: " + reason, clock.instant()));
        metrics.recordCredit("failed");
        log.warn("Credit failed for checkoutId={} (attempt {} of {}): {}",
                checkoutId, attempting.getCreditAttempts(), creditMaxAttempts, reason);
        return TransitionResult.CREDIT_FAILED;
    }

    /**
     * Gateway-reported failure. Only a transaction the gateway has accepted can
     * be closed this way: a QUEUED record may still be pushed and paid, so only
     * the dispatch worker or a client cancel may close it.
     */
    private TransitionResult close(String checkoutId, TransactionStatus target, String detail) {
        return transition(checkoutId,
                t -> isAwaitingGateway(t) && !t.isCreditInFlight() && t.canTransitionTo(target),
                t -> t.transitionTo(target, detail, clock.instant()))
                .map(t -> TransitionResult.APPLIED)
                .orElse(TransitionResult.NO_OP);
    }

    /**
     * Compare-and-set that also counts the status change.
     */
    private Optional<PaymentTransaction> transition(String checkoutId,
                                                    Predicate<PaymentTransaction> expected,
                                                    UnaryOperator<PaymentTransaction> update) {
        AtomicReference<TransactionStatus> previous = new AtomicReference<>();
        Optional<PaymentTransaction> result = store.compareAndSet(checkoutId, expected, current -> {
            previous.set(current.getStatus());
            return update.apply(current);
        });
        result.ifPresent(updated -> {
            if (updated.getStatus() != previous.get()) {
                metrics.recordTransition(previous.get(), updated.getStatus());
                log.debug("Transaction {} moved {} -> {}", checkoutId, previous.get(), updated.getStatus());
            }
        });
        return result;
    }

    private static boolean isAwaitingGateway(PaymentTransaction t) {
        return t.getStatus() == TransactionStatus.PROCESSING || t.getStatus() == TransactionStatus.PENDING;
    }

    private static String detailFor(GatewayOutcome outcome, String message) {
        if (message != null && !message.isBlank()) {
            return message;
        }
        return switch (outcome) {
            case FAILED -> "payment failed";
            case CANCELLED -> "payment cancelled by user";
            default -> "gateway reported an error";
        };
    }
}
