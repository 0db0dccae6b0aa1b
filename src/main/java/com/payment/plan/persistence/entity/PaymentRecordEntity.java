package com.payment.plan.persistence.entity;

import com.payment.plan.domain.PaymentRecordStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One installment of a plan. Owned by its plan; {@code (plan_id, payment_number)} is unique.
 */
@Entity
@Table(name = "payment_plan_payments",
        uniqueConstraints = @UniqueConstraint(name = "uk_plan_payment_number", columnNames = {"plan_id", "payment_number"}),
        indexes = {
            @Index(name = "idx_plan_payment_plan_id", columnList = "plan_id"),
            @Index(name = "idx_plan_payment_status", columnList = "status"),
            @Index(name = "idx_plan_payment_transaction_id", columnList = "transaction_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecordEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "plan_id", nullable = false, length = 64)
    private String planId;

    @Column(name = "payment_number", nullable = false)
    private int paymentNumber;

    @Column(name = "total_payments", nullable = false)
    private int totalPayments;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentRecordStatus status;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "failed_at")
    private Instant failedAt;

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
