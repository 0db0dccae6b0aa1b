package com.payment.plan.api;

/**
 * Wraps any persistence error. Retryable: the webhook endpoint answers 503 so the gateway redelivers.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
