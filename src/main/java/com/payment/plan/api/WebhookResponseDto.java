package com.payment.plan.api;

import com.payment.plan.domain.PlanStatus;
import com.payment.plan.domain.SkipReason;
import com.payment.plan.domain.TransitionOutcome;
import com.payment.plan.domain.WebhookReceipt;
import lombok.Builder;
import lombok.Value;

/**
 * Acknowledgement returned to the gateway. Any 200 stops redelivery, whether the event was applied or skipped.
 */
@Value
@Builder
public class WebhookResponseDto {

    boolean received;
    String eventId;
    String kind;
    TransitionOutcome outcome;
    SkipReason skipReason;
    String planId;
    Integer paymentNumber;
    PlanStatus planStatus;

    public static WebhookResponseDto from(WebhookReceipt receipt) {
        return WebhookResponseDto.builder()
                .received(true)
                .eventId(receipt.getEventId())
                .kind(receipt.getKind() != null ? receipt.getKind().getCode() : null)
                .outcome(receipt.getOutcome())
                .skipReason(receipt.getSkipReason())
                .planId(receipt.getPlanId())
                .paymentNumber(receipt.getPaymentNumber())
                .planStatus(receipt.getPlanStatus())
                .build();
    }
}
