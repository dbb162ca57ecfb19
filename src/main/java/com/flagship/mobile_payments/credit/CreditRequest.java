package com.flagship.mobile_payments.credit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Body sent to the balance-credit hook. checkoutId doubles as the
 * idempotency key, so a retried credit is applied once.
 */
@Value
public class CreditRequest {
    @JsonProperty("checkout_id")
    String checkoutId;

    @JsonProperty("owner_reference")
    String ownerReference;

    @JsonProperty("plan_reference")
    String planReference;

    BigDecimal amount;

    public static CreditRequest of(PaymentTransaction transaction) {
        return new CreditRequest(
            transaction.getCheckoutId(),
            transaction.getOwnerReference(),
            transaction.getPlanReference(),
            transaction.getAmount()
        );
    }
}
