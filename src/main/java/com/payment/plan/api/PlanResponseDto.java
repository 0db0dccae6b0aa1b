package com.payment.plan.api;

import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.Plan;
import com.payment.plan.domain.PlanDetails;
import com.payment.plan.domain.PlanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plan progress as returned by the REST API.
 */
@Value
@Builder
public class PlanResponseDto {

    String planId;
    String orderReference;
    PlanStatus status;
    BigDecimal totalAmount;
    int installmentCount;
    BigDecimal installmentAmount;
    int completedPayments;
    int remainingPayments;
    String subscriptionId;
    String customerEmail;
    OrderPaymentStatus orderPaymentStatus;
    Instant orderPaidAt;
    Instant createdAt;
    Instant updatedAt;
    List<PaymentRecordDto> payments;

    public static PlanResponseDto from(PlanDetails details) {
        if (details == null || details.getPlan() == null) {
            throw new IllegalArgumentException("PlanDetails cannot be null");
        }
        Plan plan = details.getPlan();
        return PlanResponseDto.builder()
                .planId(plan.getId())
                .orderReference(plan.getOrderReference())
                .status(plan.getStatus())
                .totalAmount(plan.getTotalAmount())
                .installmentCount(plan.getInstallmentCount())
                .installmentAmount(plan.getInstallmentAmount())
                .completedPayments(plan.getCompletedPayments())
                .remainingPayments(Math.max(0, plan.getInstallmentCount() - plan.getCompletedPayments()))
                .subscriptionId(plan.getSubscriptionId())
                .customerEmail(plan.getCustomerEmail())
                .orderPaymentStatus(plan.getOrderPaymentStatus())
                .orderPaidAt(plan.getOrderPaidAt())
                .createdAt(plan.getCreatedAt())
                .updatedAt(plan.getUpdatedAt())
                .payments(details.getPayments() == null ? List.of()
                        : details.getPayments().stream().map(PaymentRecordDto::from).collect(Collectors.toList()))
                .build();
    }
}
