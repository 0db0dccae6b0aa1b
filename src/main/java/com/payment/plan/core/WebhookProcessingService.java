package com.payment.plan.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.plan.api.StorageFailureException;
import com.payment.plan.domain.NormalizedPaymentEvent;
import com.payment.plan.domain.TransitionResult;
import com.payment.plan.domain.WebhookReceipt;
import com.payment.plan.normalization.EventNormalizer;
import com.payment.plan.persistence.service.WebhookAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for one gateway delivery: normalize, short-circuit known envelopes, apply to the plan,
 * archive, and remember the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookProcessingService {

    private final EventNormalizer eventNormalizer;
    private final PlanStateMachine planStateMachine;
    private final WebhookIdempotencyService idempotencyService;
    private final WebhookAuditService auditService;

    /**
     * @param envelope   parsed request body
     * @param rawPayload request body as received, for the audit archive
     * @throws StorageFailureException when the plan could not be read or written; the gateway should
     *                                 redeliver
     */
    public WebhookReceipt process(JsonNode envelope, String rawPayload) {
        NormalizedPaymentEvent event = eventNormalizer.normalize(envelope);
        log.info("Received webhook: eventId={}, eventType={}, kind={}, subscriptionId={}, transactionId={}, amount={}",
                event.getEventId(), event.getEventType(), event.getKind(),
                event.getSubscriptionId(), event.getTransactionId(), event.getAmount());

        Optional<WebhookReceipt> known = idempotencyService.findReceipt(event.getEventId());
        if (known.isPresent()) {
            log.info("Webhook {} already processed at {} with outcome={}; skipping",
                    event.getEventId(), known.get().getProcessedAt(), known.get().getOutcome());
            return known.get();
        }

        TransitionResult result;
        try {
            result = planStateMachine.apply(event);
        } catch (StorageFailureException e) {
            auditService.recordFailure(event, e, rawPayload);
            throw e;
        }

        auditService.recordOutcome(event, result, rawPayload);
        WebhookReceipt receipt = WebhookReceipt.of(event.getEventId(), result);
        // Skips like PLAN_NOT_FOUND can change once the plan is linked, so only applied outcomes are remembered
        if (result.isApplied()) {
            idempotencyService.storeReceipt(receipt);
        }
        return receipt;
    }
}
