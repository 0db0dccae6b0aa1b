package com.payment.plan.domain;

/**
 * Canonical classification of a gateway webhook. Everything the engine does not act on is UNSUPPORTED.
 */
public enum EventKind {
    INSTALLMENT_PAID("installment-paid"),
    PLAN_SUSPENDED("plan-suspended"),
    PLAN_CANCELLED("plan-cancelled"),
    UNSUPPORTED("unsupported");

    private final String code;

    EventKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
