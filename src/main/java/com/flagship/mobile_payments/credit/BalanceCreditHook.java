package com.flagship.mobile_payments.credit;

/**
 * Grants the purchased plan to the owner once a payment is confirmed.
 *
 * Implementations must be idempotent on {@link CreditRequest#getCheckoutId()}:
 * the engine retries after failures and after crashes mid-call.
 */
public interface BalanceCreditHook {

    /**
     * @throws CreditHookFailureException if the credit was not acknowledged
     */
    void credit(CreditRequest request);
}
