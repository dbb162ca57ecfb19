package com.flagship.mobile_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of an owner's payment history. Same exposure rules as
 * {@link PaymentStatusResponse}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentHistoryEntry {

    @JsonProperty("checkout_id")
    String checkoutId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("plan_reference")
    String planReference;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("error_detail")
    String errorDetail;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentHistoryEntry from(PaymentTransaction transaction) {
        return PaymentHistoryEntry.builder()
            .checkoutId(transaction.getCheckoutId())
            .status(transaction.getStatus())
            .amount(transaction.getAmount())
            .planReference(transaction.getPlanReference())
            .reference(transaction.getStatus() == TransactionStatus.COMPLETED ? transaction.getReference() : null)
            .errorDetail(transaction.isTerminal() ? transaction.getErrorDetail() : null)
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
