package com.flagship.mobile_payments.payment.exception;

/**
 * A payment intent failed validation before it was queued.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
