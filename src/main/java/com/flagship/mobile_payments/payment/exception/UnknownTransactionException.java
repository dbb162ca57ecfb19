package com.flagship.mobile_payments.payment.exception;

/**
 * A gateway outcome referenced neither a known remote checkout id nor a
 * known local checkout id.
 */
public class UnknownTransactionException extends RuntimeException {

    public UnknownTransactionException(String gatewayCheckoutId) {
        super("No transaction matches gateway checkout id " + gatewayCheckoutId);
    }
}
