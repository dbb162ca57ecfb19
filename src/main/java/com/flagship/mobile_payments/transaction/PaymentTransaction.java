package com.flagship.mobile_payments.transaction;

import lombok.AccessLevel;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment transaction domain object.
 *
 * Immutable: every state change returns a new instance. Transition methods
 * reject moves the state machine in {@link TransactionStatus} does not allow,
 * so a caller can never build an invalid successor by accident.
 *
 * checkoutId, ownerReference, amount and planReference never change after
 * {@link #create}. Timestamps come from the caller so that every change is
 * stamped by the same clock the background cutoffs are computed from.
 */
@Value
@With(AccessLevel.PRIVATE)
public class PaymentTransaction {
    String checkoutId;
    String remoteCheckoutId;
    String ownerReference;
    BigDecimal amount;
    String planReference;
    String msisdn;
    TransactionStatus status;
    String errorDetail;
    String reference;
    CreditState creditState;
    int creditAttempts;
    Instant creditAttemptedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new transaction in QUEUED status.
     */
    public static PaymentTransaction create(String checkoutId, String ownerReference, BigDecimal amount,
                                            String planReference, String msisdn, Instant now) {
        return new PaymentTransaction(
            checkoutId,
            null,
            ownerReference,
            amount,
            planReference,
            msisdn,
            TransactionStatus.QUEUED,
            null,
            null,
            CreditState.NONE,
            0,
            null,
            now,
            now
        );
    }

    /**
     * Key identifying "the same payment intent" for duplicate detection.
     */
    public static String dedupKeyOf(String ownerReference, BigDecimal amount, String planReference) {
        return ownerReference + "|" + amount.stripTrailingZeros().toPlainString() + "|" + planReference;
    }

    public String dedupKey() {
        return dedupKeyOf(ownerReference, amount, planReference);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return status.canTransitionTo(target);
    }

    /**
     * True once the gateway confirmed success and the credit hook has been
     * attempted but not yet acknowledged. Such a transaction must not be closed
     * by any outcome other than COMPLETED or credit exhaustion.
     */
    public boolean isCreditInFlight() {
        return creditState == CreditState.ATTEMPTING || creditState == CreditState.FAILED;
    }

    /**
     * Moves to the target status.
     *
     * @throws IllegalStateException if the state machine does not allow the move
     */
    public PaymentTransaction transitionTo(TransactionStatus target, String detail, Instant at) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move transaction %s from %s to %s", checkoutId, status, target));
        }
        return this.withStatus(target)
                .withErrorDetail(detail)
                .withUpdatedAt(at);
    }

    /**
     * QUEUED -> PROCESSING once the gateway acknowledged the push request.
     */
    public PaymentTransaction acceptedByGateway(String gatewayCheckoutId, Instant at) {
        if (status != TransactionStatus.QUEUED) {
            throw new IllegalStateException(
                String.format("Cannot record gateway acceptance for %s in %s status", checkoutId, status));
        }
        return transitionTo(TransactionStatus.PROCESSING, null, at)
                .withRemoteCheckoutId(gatewayCheckoutId);
    }

    /**
     * Records that the credit hook is about to be called. Status stays
     * PROCESSING or PENDING until the hook acknowledges.
     */
    public PaymentTransaction beginCredit(String settlementReference, Instant at) {
        if (status != TransactionStatus.PROCESSING && status != TransactionStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot credit transaction %s in %s status", checkoutId, status));
        }
        if (creditState == CreditState.CREDITED) {
            throw new IllegalStateException("Transaction " + checkoutId + " has already been credited");
        }
        return this.withCreditState(CreditState.ATTEMPTING)
                .withCreditAttempts(creditAttempts + 1)
                .withCreditAttemptedAt(at)
                .withReference(settlementReference != null ? settlementReference : reference)
                .withUpdatedAt(at);
    }

    /**
     * The hook acknowledged: the transaction is durably completed.
     */
    public PaymentTransaction creditSucceeded(Instant at) {
        if (creditState != CreditState.ATTEMPTING) {
            throw new IllegalStateException(
                String.format("Cannot complete transaction %s with credit state %s", checkoutId, creditState));
        }
        return transitionTo(TransactionStatus.COMPLETED, null, at)
                .withCreditState(CreditState.CREDITED);
    }

    /**
     * The hook failed; status is held where it was so the credit can be retried.
     */
    public PaymentTransaction creditFailed(String detail, Instant at) {
        return this.withCreditState(CreditState.FAILED)
                .withErrorDetail(detail)
                .withUpdatedAt(at);
    }

    /**
     * The credit retry budget is spent: the transaction surfaces as ERROR.
     */
    public PaymentTransaction creditExhausted(String detail, Instant at) {
        return transitionTo(TransactionStatus.ERROR, detail, at)
                .withCreditState(CreditState.FAILED);
    }
}
