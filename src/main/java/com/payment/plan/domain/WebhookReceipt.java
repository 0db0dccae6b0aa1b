package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome recorded for a gateway envelope id so a redelivery can be answered without touching the plan.
 */
@Value
@Builder
@Jacksonized
public class WebhookReceipt {

    String eventId;
    EventKind kind;
    TransitionOutcome outcome;
    SkipReason skipReason;
    String planId;
    Integer paymentNumber;
    PlanStatus planStatus;
    Instant processedAt;

    public static WebhookReceipt of(String eventId, TransitionResult result) {
        return WebhookReceipt.builder()
                .eventId(eventId)
                .kind(result.getKind())
                .outcome(result.getOutcome())
                .skipReason(result.getSkipReason())
                .planId(result.getPlanId())
                .paymentNumber(result.getPaymentNumber())
                .planStatus(result.getPlanStatus())
                .processedAt(Instant.now())
                .build();
    }
}
