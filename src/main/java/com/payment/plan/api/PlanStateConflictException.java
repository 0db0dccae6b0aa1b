package com.payment.plan.api;

/**
 * The plan is not in a state that allows the requested change, e.g. linking a first payment to a
 * plan that is already active. Mapped to 409.
 */
public class PlanStateConflictException extends RuntimeException {

    public PlanStateConflictException(String message) {
        super(message);
    }
}
