package com.payment.plan.domain;

/**
 * Why a webhook did not change any state. None of these are errors.
 */
public enum SkipReason {
    UNSUPPORTED_EVENT,
    MISSING_SUBSCRIPTION_ID,
    PLAN_NOT_FOUND,
    NOT_A_PAYMENT_PLAN,
    PLAN_NOT_ACTIVE,
    DUPLICATE_DELIVERY,
    INSTALLMENTS_EXHAUSTED,
    PAYMENT_RECORD_MISSING,
    ALREADY_IN_STATE
}
