package com.payment.plan.domain;

/**
 * Lifecycle of an installment plan. Stored lowercase-insensitive as the enum name.
 */
public enum PlanStatus {
    /** Plan created, no subscription linked yet. */
    PENDING,
    /** Subscription running, at least one and fewer than all installments paid. */
    ACTIVE,
    /** All installments paid. Terminal. */
    COMPLETED,
    /** Gateway suspended the subscription after a failed charge. Only an operator can resume it. */
    SUSPENDED,
    /** Subscription cancelled or terminated. Terminal. */
    CANCELLED;

    public boolean acceptsPayments() {
        return this == PENDING || this == ACTIVE;
    }
}
