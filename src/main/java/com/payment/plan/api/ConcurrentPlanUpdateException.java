package com.payment.plan.api;

/**
 * Thrown when a compare-and-swap on plan state lost against a concurrent transition, or the
 * per-subscription lock could not be acquired in time. Retried by the state machine before it
 * surfaces to the gateway as a retryable storage failure.
 */
public class ConcurrentPlanUpdateException extends StorageFailureException {

    public ConcurrentPlanUpdateException(String message) {
        super(message);
    }

    public ConcurrentPlanUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
