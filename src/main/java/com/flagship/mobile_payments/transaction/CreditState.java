package com.flagship.mobile_payments.transaction;

/**
 * Progress of the balance-credit hook for a transaction the gateway confirmed.
 *
 * ATTEMPTING is written before the hook is called, so a crash while the hook is
 * in flight leaves a record the recovery pass can find and retry.
 */
public enum CreditState {
    NONE,
    ATTEMPTING,
    FAILED,
    CREDITED
}
