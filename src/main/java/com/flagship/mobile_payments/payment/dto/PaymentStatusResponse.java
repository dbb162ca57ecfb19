package com.flagship.mobile_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Public view of a transaction.
 *
 * error_detail is only shown once the transaction is terminal: a credit
 * failure that is still being retried is not the client's concern yet.
 * reference is only shown for completed payments.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentStatusResponse {

    @JsonProperty("checkout_id")
    String checkoutId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("error_detail")
    String errorDetail;

    @JsonProperty("reference")
    String reference;

    public static PaymentStatusResponse from(PaymentTransaction transaction) {
        return PaymentStatusResponse.builder()
            .checkoutId(transaction.getCheckoutId())
            .status(transaction.getStatus())
            .errorDetail(transaction.isTerminal() ? transaction.getErrorDetail() : null)
            .reference(transaction.getStatus() == TransactionStatus.COMPLETED ? transaction.getReference() : null)
            .build();
    }
}
