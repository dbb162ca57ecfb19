package com.flagship.mobile_payments.transaction;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for payment transactions.
 *
 * Key design principles:
 * - No @Setter: state only changes through updateFromDomain() or the dispatch claim
 * - Identity and payment intent columns are updatable = false
 * - @Version backs the per-record compare-and-set in {@link JpaTransactionStore}
 *
 * dedupKey and the dispatch claim columns are persistence concerns; the domain
 * object never sees them.
 */
@Entity
@Table(
    name = "payment_transactions",
    indexes = {
        @Index(name = "idx_payment_transactions_remote_checkout_id", columnList = "remote_checkout_id", unique = true),
        @Index(name = "idx_payment_transactions_owner_status", columnList = "owner_reference, status"),
        @Index(name = "idx_payment_transactions_dedup_key", columnList = "dedup_key"),
        @Index(name = "idx_payment_transactions_status_created", columnList = "status, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentTransactionEntity {

    @Id
    @Column(name = "checkout_id", nullable = false, updatable = false, length = 64)
    private String checkoutId;

    @Column(name = "remote_checkout_id", length = 128)
    private String remoteCheckoutId;

    @Column(name = "owner_reference", nullable = false, updatable = false)
    private String ownerReference;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "plan_reference", nullable = false, updatable = false, length = 64)
    private String planReference;

    @Column(name = "msisdn", updatable = false, length = 20)
    private String msisdn;

    @Column(name = "dedup_key", nullable = false, updatable = false)
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "reference", length = 128)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "credit_state", nullable = false, length = 20)
    private CreditState creditState;

    @Column(name = "credit_attempts", nullable = false)
    private int creditAttempts;

    @Column(name = "credit_attempted_at")
    private Instant creditAttemptedAt;

    @Column(name = "dispatch_claimed_at")
    private Instant dispatchClaimedAt;

    @Column(name = "dispatch_claims", nullable = false)
    private int dispatchClaims;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    /**
     * Controlled factory: the only way to create a transaction row.
     */
    static PaymentTransactionEntity fromDomain(PaymentTransaction transaction) {
        return new PaymentTransactionEntity(
            transaction.getCheckoutId(),
            transaction.getRemoteCheckoutId(),
            transaction.getOwnerReference(),
            transaction.getAmount(),
            transaction.getPlanReference(),
            transaction.getMsisdn(),
            transaction.dedupKey(),
            transaction.getStatus(),
            transaction.getErrorDetail(),
            transaction.getReference(),
            transaction.getCreditState(),
            transaction.getCreditAttempts(),
            transaction.getCreditAttemptedAt(),
            null, // not claimed yet
            0,
            transaction.getCreatedAt(),
            transaction.getUpdatedAt(),
            null  // assigned on insert
        );
    }

    public PaymentTransaction toDomain() {
        return new PaymentTransaction(
            checkoutId,
            remoteCheckoutId,
            ownerReference,
            amount,
            planReference,
            msisdn,
            status,
            errorDetail,
            reference,
            creditState,
            creditAttempts,
            creditAttemptedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields of the domain object.
     * Identity, amount, plan and owner are never touched after insert.
     */
    void updateFromDomain(PaymentTransaction transaction) {
        if (!checkoutId.equals(transaction.getCheckoutId())) {
            throw new IllegalArgumentException(
                "Cannot update transaction " + checkoutId + " from " + transaction.getCheckoutId());
        }
        this.remoteCheckoutId = transaction.getRemoteCheckoutId();
        this.status = transaction.getStatus();
        this.errorDetail = transaction.getErrorDetail();
        this.reference = transaction.getReference();
        this.creditState = transaction.getCreditState();
        this.creditAttempts = transaction.getCreditAttempts();
        this.creditAttemptedAt = transaction.getCreditAttemptedAt();
        this.updatedAt = transaction.getUpdatedAt();
    }

    /**
     * Marks the row as handed to a dispatch worker. A claim older than the
     * claim timeout may be taken over by another worker after a crash.
     */
    void claimForDispatch(Instant now) {
        if (status != TransactionStatus.QUEUED) {
            throw new IllegalStateException(
                "Cannot claim transaction " + checkoutId + " in " + status + " status for dispatch");
        }
        this.dispatchClaimedAt = now;
        this.dispatchClaims++;
    }
}
