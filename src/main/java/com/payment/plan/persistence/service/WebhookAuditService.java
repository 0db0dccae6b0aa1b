package com.payment.plan.persistence.service;

import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.NormalizedPaymentEvent;
import com.payment.plan.domain.TransitionResult;
import com.payment.plan.persistence.entity.WebhookEventEntity;
import com.payment.plan.persistence.repository.WebhookEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Archives every webhook delivery with its outcome. Archiving is best-effort: a failure here is
 * logged and never changes the response to the gateway. Each row is written and committed in its
 * own transaction so that constraint errors surface inside this class.
 */
@Slf4j
@Service
public class WebhookAuditService {

    static final int MAX_DETAIL_LENGTH = 1000;
    static final int MAX_EVENT_ID_LENGTH = 100;
    static final int MAX_EVENT_TYPE_LENGTH = 150;
    static final int MAX_REFERENCE_LENGTH = 100;
    /** numeric(12,2) holds at most ten integer digits. */
    static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    private final WebhookEventRepository webhookEventRepository;
    private final TransactionTemplate transactionTemplate;

    public WebhookAuditService(WebhookEventRepository webhookEventRepository,
                               PlatformTransactionManager transactionManager) {
        this.webhookEventRepository = webhookEventRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void recordOutcome(NormalizedPaymentEvent event, TransitionResult result, String rawPayload) {
        String detail = result.getSkipReason() != null
                ? result.getSkipReason().name()
                : describeApplied(result);
        persist(event, result.getPlanId(), result.getOutcome().name(), detail, rawPayload);
    }

    public void recordFailure(NormalizedPaymentEvent event, Throwable error, String rawPayload) {
        persist(event, null, "FAILED", error.getMessage(), rawPayload);
    }

    private void persist(NormalizedPaymentEvent event, String planId, String outcome, String detail, String rawPayload) {
        try {
            WebhookEventEntity entity = WebhookEventEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gatewayEventId(truncate(event.getEventId(), MAX_EVENT_ID_LENGTH))
                    .eventType(truncate(event.getEventType(), MAX_EVENT_TYPE_LENGTH))
                    .kind(event.getKind() != null ? event.getKind() : EventKind.UNSUPPORTED)
                    .subscriptionId(truncate(event.getSubscriptionId(), MAX_REFERENCE_LENGTH))
                    .transactionId(truncate(event.getTransactionId(), MAX_REFERENCE_LENGTH))
                    .amount(storableAmount(event))
                    .planId(planId)
                    .outcome(outcome)
                    .detail(truncate(detail, MAX_DETAIL_LENGTH))
                    .rawPayload(rawPayload)
                    .build();
            transactionTemplate.executeWithoutResult(status -> webhookEventRepository.saveAndFlush(entity));
            log.debug("Archived webhook delivery: eventId={}, kind={}, outcome={}",
                    event.getEventId(), event.getKind(), outcome);
        } catch (RuntimeException e) {
            // Archive loss must not fail the webhook
            log.error("Failed to archive webhook delivery: eventId={}", event.getEventId(), e);
        }
    }

    private static BigDecimal storableAmount(NormalizedPaymentEvent event) {
        BigDecimal amount = event.getAmount();
        if (amount != null && amount.abs().compareTo(MAX_AMOUNT) > 0) {
            log.warn("Amount {} of webhook {} does not fit the archive column; stored as null",
                    amount, event.getEventId());
            return null;
        }
        return amount;
    }

    private static String describeApplied(TransitionResult result) {
        StringBuilder sb = new StringBuilder("status=").append(result.getPlanStatus());
        if (result.getPaymentNumber() != null) {
            sb.append(", payment=").append(result.getPaymentNumber());
            if (result.getTotalPayments() != null) {
                sb.append('/').append(result.getTotalPayments());
            }
        }
        if (result.isHealed()) {
            sb.append(", healed");
        }
        return sb.toString();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
