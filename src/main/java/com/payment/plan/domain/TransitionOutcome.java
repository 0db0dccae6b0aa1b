package com.payment.plan.domain;

public enum TransitionOutcome {
    /** State was written. */
    APPLIED,
    /** Benign no-op; the gateway must not redeliver. */
    SKIPPED
}
