package com.payment.plan.notification;

import com.payment.plan.domain.PlanStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published to Kafka for every applied plan transition, keyed by plan id so consumers see
 * one plan's events in order.
 */
@Value
@Builder
@Jacksonized
public class PlanLifecycleEvent {

    String eventId;
    /** INSTALLMENT_PAID, PLAN_COMPLETED, PLAN_SUSPENDED or PLAN_CANCELLED */
    String eventType;
    String planId;
    String orderReference;
    String subscriptionId;
    String customerEmail;
    PlanStatus status;
    Integer paymentNumber;
    int completedPayments;
    int installmentCount;
    BigDecimal totalAmount;
    Instant timestamp;
}
