package com.payment.plan.persistence.entity;

import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PlanStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persistent installment plan, one per quote/order billed in installments.
 * {@code version} backs optimistic compare-and-swap on {@code completedPayments}.
 */
@Entity
@Table(name = "payment_plans", indexes = {
    @Index(name = "idx_plan_subscription_id", columnList = "subscription_id", unique = true),
    @Index(name = "idx_plan_order_reference", columnList = "order_reference"),
    @Index(name = "idx_plan_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "order_reference", length = 100)
    private String orderReference;

    @Column(name = "is_payment_plan", nullable = false)
    private boolean paymentPlan;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "installment_count", nullable = false)
    private int installmentCount;

    @Column(name = "installment_amount", precision = 12, scale = 2)
    private BigDecimal installmentAmount;

    @Column(name = "subscription_id", length = 100)
    private String subscriptionId;

    @Column(name = "completed_payments", nullable = false)
    private int completedPayments;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PlanStatus status;

    @Column(name = "customer_email")
    private String customerEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_payment_status", nullable = false, length = 20)
    private OrderPaymentStatus orderPaymentStatus;

    @Column(name = "order_paid_at")
    private Instant orderPaidAt;

    @Column(name = "order_transaction_id", length = 100)
    private String orderTransactionId;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
