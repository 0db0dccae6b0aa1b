package com.payment.plan.api;

/**
 * Thrown when a plan is created with a non-positive total or an installment count outside [2, 12].
 * Never raised from webhook handling. Handler returns HTTP 400.
 */
public class InvalidPlanParametersException extends RuntimeException {

    public InvalidPlanParametersException(String message) {
        super(message);
    }
}
