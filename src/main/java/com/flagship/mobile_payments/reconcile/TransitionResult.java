package com.flagship.mobile_payments.reconcile;

public enum TransitionResult {
    /**
     * The record moved to a new status.
     */
    APPLIED,

    /**
     * The record was already past the point this outcome applies to.
     */
    NO_OP,

    /**
     * The gateway confirmed the payment but the credit hook failed; the record
     * is held for the recovery pass, or moved to ERROR if the budget is spent.
     */
    CREDIT_FAILED
}
