package com.payment.plan.domain;

import lombok.Value;

/**
 * Outcome of pre-submission plan validation. {@code error} is a human-readable reason, null when valid.
 */
@Value
public class PlanValidationResult {

    boolean valid;
    String error;

    public static PlanValidationResult ok() {
        return new PlanValidationResult(true, null);
    }

    public static PlanValidationResult invalid(String error) {
        return new PlanValidationResult(false, error);
    }
}
