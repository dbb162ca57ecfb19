package com.flagship.mobile_payments.credit;

/**
 * The balance-credit hook did not acknowledge a credit.
 */
public class CreditHookFailureException extends RuntimeException {

    public CreditHookFailureException(String message) {
        super(message);
    }

    public CreditHookFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
