package com.payment.plan.persistence.store;

import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PlanStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial plan update. Null fields are left untouched.
 */
@Value
@Builder
public class PlanUpdate {

    PlanStatus status;
    Integer completedPayments;
    /** Compare-and-swap guard on the stored counter. */
    Integer expectedCompletedPayments;
    String subscriptionId;
    OrderPaymentStatus orderPaymentStatus;
    Instant orderPaidAt;
    String orderTransactionId;
}
