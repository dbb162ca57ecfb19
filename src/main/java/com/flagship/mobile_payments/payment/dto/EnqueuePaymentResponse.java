package com.flagship.mobile_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import lombok.Value;

@Value
public class EnqueuePaymentResponse {

    @JsonProperty("checkout_id")
    String checkoutId;

    @JsonProperty("status")
    TransactionStatus status;

    public static EnqueuePaymentResponse from(PaymentTransaction transaction) {
        return new EnqueuePaymentResponse(transaction.getCheckoutId(), transaction.getStatus());
    }
}
