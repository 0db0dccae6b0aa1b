package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of an installment plan as read from the {@code PlanStore}.
 * Invariant: {@code 0 <= completedPayments <= installmentCount}, and
 * {@code status == COMPLETED} iff every installment is paid.
 */
@Value
@Builder(toBuilder = true)
public class Plan {

    String id;
    /** Quote/order number shown to humans and sent to the CRM. */
    String orderReference;
    /** False for orders that are paid in one charge; webhook transitions ignore them. */
    boolean paymentPlan;
    BigDecimal totalAmount;
    int installmentCount;
    /** Recurring installment amount charged by the subscription. */
    BigDecimal installmentAmount;
    /** Gateway recurring-subscription id; null until the first payment links it. */
    String subscriptionId;
    int completedPayments;
    PlanStatus status;
    String customerEmail;
    OrderPaymentStatus orderPaymentStatus;
    Instant orderPaidAt;
    String orderTransactionId;
    Instant createdAt;
    Instant updatedAt;

    public boolean isFullyPaid() {
        return completedPayments >= installmentCount;
    }
}
