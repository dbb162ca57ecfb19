package com.flagship.mobile_payments.payment.exception;

import lombok.Getter;

@Getter
public class TransactionNotFoundException extends RuntimeException {

    private final String checkoutId;

    public TransactionNotFoundException(String checkoutId) {
        super("Transaction not found: " + checkoutId);
        this.checkoutId = checkoutId;
    }
}
