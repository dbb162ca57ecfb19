package com.flagship.mobile_payments.payment.exception;

import lombok.Getter;

/**
 * A live transaction for the same owner, amount and plan already exists
 * inside the dedup window.
 */
@Getter
public class DuplicateRequestException extends RuntimeException {

    private final String existingCheckoutId;

    public DuplicateRequestException(String existingCheckoutId) {
        super("A payment for this request is already in progress: " + existingCheckoutId);
        this.existingCheckoutId = existingCheckoutId;
    }
}
