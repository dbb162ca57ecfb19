package com.flagship.mobile_payments.payment.exception;

import com.flagship.mobile_payments.transaction.TransactionStatus;
import lombok.Getter;

/**
 * Raised when a client tries to cancel a transaction that already reached
 * a terminal status.
 */
@Getter
public class TransactionAlreadyTerminalException extends RuntimeException {

    private final String checkoutId;
    private final TransactionStatus status;

    public TransactionAlreadyTerminalException(String checkoutId, TransactionStatus status) {
        super(String.format("Transaction %s is already %s", checkoutId, status.wireName()));
        this.checkoutId = checkoutId;
        this.status = status;
    }
}
