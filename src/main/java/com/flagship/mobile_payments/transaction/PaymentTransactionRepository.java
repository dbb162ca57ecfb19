package com.flagship.mobile_payments.transaction;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, String> {

    Optional<PaymentTransactionEntity> findByRemoteCheckoutId(String remoteCheckoutId);

    /**
     * Payment history of one owner, newest first. Served by the
     * (owner_reference, status) index.
     */
    List<PaymentTransactionEntity> findByOwnerReferenceOrderByCreatedAtDesc(String ownerReference, Pageable page);

    List<PaymentTransactionEntity> findByOwnerReferenceAndStatusOrderByCreatedAtDesc(String ownerReference,
                                                                                     TransactionStatus status,
                                                                                     Pageable page);

    /**
     * Claims the oldest queued rows for dispatch.
     * SKIP LOCKED lets several workers drain the queue without handing the
     * same row to two of them; a claim older than reclaimBefore is treated as
     * abandoned.
     */
    @Query(value = """
        SELECT * FROM payment_transactions
        WHERE status = 'QUEUED'
          AND (dispatch_claimed_at IS NULL OR dispatch_claimed_at < :reclaimBefore)
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<PaymentTransactionEntity> findQueuedForDispatch(@Param("reclaimBefore") Instant reclaimBefore,
                                                         @Param("limit") int limit);

    /**
     * Live duplicates of a payment intent created inside the dedup window.
     */
    @Query("""
        SELECT t FROM PaymentTransactionEntity t
        WHERE t.dedupKey = :dedupKey
          AND t.status IN :live
          AND t.createdAt >= :since
        ORDER BY t.createdAt ASC
        """)
    List<PaymentTransactionEntity> findLiveDuplicates(@Param("dedupKey") String dedupKey,
                                                      @Param("live") Collection<TransactionStatus> live,
                                                      @Param("since") Instant since);

    /**
     * Transactions the gateway has accepted but not resolved, quiet for longer
     * than the poll grace period.
     */
    @Query(value = """
        SELECT * FROM payment_transactions
        WHERE status IN ('PROCESSING', 'PENDING')
          AND remote_checkout_id IS NOT NULL
          AND credit_state = 'NONE'
          AND updated_at < :updatedBefore
        ORDER BY updated_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<PaymentTransactionEntity> findAwaitingGateway(@Param("updatedBefore") Instant updatedBefore,
                                                       @Param("limit") int limit);

    @Query(value = """
        SELECT * FROM payment_transactions
        WHERE status IN ('QUEUED', 'PROCESSING', 'PENDING')
          AND credit_state = 'NONE'
          AND created_at < :createdBefore
        ORDER BY created_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<PaymentTransactionEntity> findStale(@Param("createdBefore") Instant createdBefore,
                                             @Param("limit") int limit);

    /**
     * Credits that failed, or that were started and never resolved (crash
     * while the hook was in flight).
     */
    @Query(value = """
        SELECT * FROM payment_transactions
        WHERE status IN ('PROCESSING', 'PENDING')
          AND (credit_state = 'FAILED'
               OR (credit_state = 'ATTEMPTING' AND credit_attempted_at < :attemptedBefore))
        ORDER BY credit_attempted_at ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<PaymentTransactionEntity> findIncompleteCredits(@Param("attemptedBefore") Instant attemptedBefore,
                                                         @Param("limit") int limit);

    long countByStatus(TransactionStatus status);
}
