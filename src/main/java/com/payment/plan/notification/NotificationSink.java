package com.payment.plan.notification;

import com.payment.plan.domain.Plan;

/**
 * Outbound side effect fired after a plan transition has been committed. Implementations may throw;
 * the dispatcher isolates each sink so a failure never reaches the state machine.
 */
public interface NotificationSink {

    /** Short name used in logs and circuit breaker lookups. */
    String getName();

    boolean isEnabled();

    void notifyInstallmentPaid(Plan plan, int paymentNumber);

    void notifyPlanSuspended(Plan plan);

    void notifyPlanCancelled(Plan plan);
}
