package com.payment.plan.notification;

/**
 * Thrown by a sink when the downstream system rejected or could not receive a notification.
 */
public class NotificationFailureException extends RuntimeException {

    public NotificationFailureException(String message) {
        super(message);
    }

    public NotificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
