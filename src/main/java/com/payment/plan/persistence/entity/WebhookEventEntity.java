package com.payment.plan.persistence.entity;

import com.payment.plan.domain.EventKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit archive of webhook deliveries. Redeliveries of one gateway event produce one row each.
 */
@Entity
@Table(name = "webhook_events", indexes = {
    @Index(name = "idx_webhook_gateway_event_id", columnList = "gateway_event_id"),
    @Index(name = "idx_webhook_subscription_id", columnList = "subscription_id"),
    @Index(name = "idx_webhook_received_at", columnList = "received_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEventEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "gateway_event_id", length = 100)
    private String gatewayEventId;

    @Column(name = "event_type", length = 150)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private EventKind kind;

    @Column(name = "subscription_id", length = 100)
    private String subscriptionId;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Column(name = "amount", precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "plan_id", length = 64)
    private String planId;

    @Column(name = "outcome", length = 30)
    private String outcome;

    @Column(name = "detail", length = 1000)
    private String detail;

    @Lob
    @Column(name = "raw_payload")
    private String rawPayload;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}
