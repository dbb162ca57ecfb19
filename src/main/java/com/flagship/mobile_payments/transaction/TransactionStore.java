package com.flagship.mobile_payments.transaction;

import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable record of every payment attempt.
 *
 * All state changes go through {@link #compareAndSet}: the update is applied
 * only if the stored record still satisfies the expected predicate at write
 * time. Records are never deleted.
 */
public interface TransactionStore {

    /**
     * Inserts the candidate unless a live transaction with the same dedup key
     * was created at or after windowStart.
     *
     * @return the inserted record, or the existing live duplicate (its
     *         checkout id differs from the candidate's)
     */
    PaymentTransaction insertIfAbsent(PaymentTransaction candidate, Instant windowStart);

    Optional<PaymentTransaction> findByCheckoutId(String checkoutId);

    Optional<PaymentTransaction> findByRemoteCheckoutId(String remoteCheckoutId);

    /**
     * Up to limit transactions of one owner, newest first, optionally
     * restricted to one status (null for all).
     */
    List<PaymentTransaction> findByOwner(String ownerReference, TransactionStatus status, int limit);

    /**
     * Atomically applies update to the record if expected holds for its
     * current committed state.
     *
     * @return the stored result, or empty if the predicate did not hold
     * @throws TransactionNotFoundException if no record has this checkout id
     */
    Optional<PaymentTransaction> compareAndSet(String checkoutId,
                                               Predicate<PaymentTransaction> expected,
                                               UnaryOperator<PaymentTransaction> update);

    /**
     * Claims up to limit QUEUED records, oldest first, for dispatch. A record
     * claimed before reclaimBefore and still QUEUED may be claimed again.
     */
    List<PaymentTransaction> claimQueued(int limit, Instant reclaimBefore);

    /**
     * PROCESSING or PENDING records with a remote checkout id, no credit in
     * flight and no update since updatedBefore.
     */
    List<PaymentTransaction> findAwaitingGateway(Instant updatedBefore, int limit);

    /**
     * Non-terminal records without a credit in flight created before createdBefore.
     */
    List<PaymentTransaction> findStale(Instant createdBefore, int limit);

    /**
     * Records whose credit failed, or has been ATTEMPTING since before attemptedBefore.
     */
    List<PaymentTransaction> findIncompleteCredits(Instant attemptedBefore, int limit);

    long countByStatus(TransactionStatus status);
}
