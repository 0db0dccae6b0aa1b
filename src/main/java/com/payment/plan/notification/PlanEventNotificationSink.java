package com.payment.plan.notification;

import com.payment.plan.domain.Plan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes {@link PlanLifecycleEvent}s for downstream consumers (fulfilment, reporting).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanEventNotificationSink implements NotificationSink {

    private final KafkaTemplate<String, PlanLifecycleEvent> kafkaTemplate;

    @Value("${payment-plan.notification.kafka.enabled:true}")
    private boolean enabled = true;

    @Value("${payment-plan.kafka.topic.plan-events:payment-plan-events}")
    private String topic = "payment-plan-events";

    @Override
    public String getName() {
        return "kafka";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void notifyInstallmentPaid(Plan plan, int paymentNumber) {
        send(plan, plan.isFullyPaid() ? "PLAN_COMPLETED" : "INSTALLMENT_PAID", paymentNumber);
    }

    @Override
    public void notifyPlanSuspended(Plan plan) {
        send(plan, "PLAN_SUSPENDED", plan.getCompletedPayments() + 1);
    }

    @Override
    public void notifyPlanCancelled(Plan plan) {
        send(plan, "PLAN_CANCELLED", null);
    }

    private void send(Plan plan, String eventType, Integer paymentNumber) {
        PlanLifecycleEvent event = PlanLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .planId(plan.getId())
                .orderReference(plan.getOrderReference())
                .subscriptionId(plan.getSubscriptionId())
                .customerEmail(plan.getCustomerEmail())
                .status(plan.getStatus())
                .paymentNumber(paymentNumber)
                .completedPayments(plan.getCompletedPayments())
                .installmentCount(plan.getInstallmentCount())
                .totalAmount(plan.getTotalAmount())
                .timestamp(Instant.now())
                .build();

        log.info("Publishing plan event: planId={}, eventId={}, eventType={}, status={}",
                plan.getId(), event.getEventId(), eventType, plan.getStatus());
        CompletableFuture<SendResult<String, PlanLifecycleEvent>> future =
                kafkaTemplate.send(topic, plan.getId(), event);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish plan event planId={} eventId={}", plan.getId(), event.getEventId(), ex);
            } else {
                log.debug("Published plan event: planId={}, eventId={}, partition={}, offset={}",
                        plan.getId(), event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
