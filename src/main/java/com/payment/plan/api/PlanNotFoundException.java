package com.payment.plan.api;

/**
 * Raised by the REST API only (status and first-payment endpoints). Webhook handling treats a
 * missing plan as a no-op instead.
 */
public class PlanNotFoundException extends RuntimeException {

    public PlanNotFoundException(String planId) {
        super("Payment plan not found: " + planId);
    }
}
