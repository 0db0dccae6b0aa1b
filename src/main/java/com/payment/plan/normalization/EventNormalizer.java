package com.payment.plan.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.NormalizedPaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Turns a raw gateway envelope ({@code {id, eventType, eventDate, payload}}) into a
 * {@link NormalizedPaymentEvent}. Total over arbitrary input: missing fields fall back to null
 * identifiers, empty text and zero amounts, and anything unrecognizable becomes UNSUPPORTED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventNormalizer {

    private final FieldPathResolver resolver;
    private final EventKindClassifier classifier;
    private final MoneyParser moneyParser;

    public NormalizedPaymentEvent normalize(JsonNode envelope) {
        try {
            return doNormalize(envelope);
        } catch (RuntimeException e) {
            log.warn("Webhook envelope could not be normalized, treating as unsupported: {}", e.getMessage());
            return NormalizedPaymentEvent.builder()
                    .kind(EventKind.UNSUPPORTED)
                    .amount(BigDecimal.ZERO.setScale(2))
                    .customerEmail("")
                    .eventType("")
                    .build();
        }
    }

    private NormalizedPaymentEvent doNormalize(JsonNode envelope) {
        String eventType = text(envelope, WebhookFieldPaths.EVENT_TYPE, "");
        EventKind kind = classifier.classify(eventType);
        boolean transactionFamily = kind != EventKind.PLAN_SUSPENDED && kind != EventKind.PLAN_CANCELLED;

        NormalizedPaymentEvent event = NormalizedPaymentEvent.builder()
                .eventId(text(envelope, WebhookFieldPaths.EVENT_ID, null))
                .eventType(eventType)
                .eventDate(text(envelope, WebhookFieldPaths.EVENT_DATE, null))
                .kind(kind)
                .subscriptionId(text(envelope, transactionFamily
                        ? WebhookFieldPaths.PAYMENT_SUBSCRIPTION_ID
                        : WebhookFieldPaths.MANAGEMENT_SUBSCRIPTION_ID, null))
                .transactionId(text(envelope, transactionFamily
                        ? WebhookFieldPaths.PAYMENT_TRANSACTION_ID
                        : WebhookFieldPaths.MANAGEMENT_TRANSACTION_ID, null))
                .amount(resolver.firstPresent(envelope, WebhookFieldPaths.AMOUNT)
                        .map(moneyParser::parse)
                        .orElseGet(() -> moneyParser.parse((String) null)))
                .customerEmail(text(envelope, WebhookFieldPaths.CUSTOMER_EMAIL, ""))
                .invoiceNumber(text(envelope, WebhookFieldPaths.INVOICE_NUMBER, null))
                .build();

        log.debug("Normalized webhook: eventId={}, eventType={}, kind={}, subscriptionId={}, transactionId={}, amount={}",
                event.getEventId(), eventType, kind, event.getSubscriptionId(), event.getTransactionId(), event.getAmount());
        return event;
    }

    private String text(JsonNode envelope, List<String> paths, String fallback) {
        return resolver.firstText(envelope, paths).orElse(fallback);
    }
}
