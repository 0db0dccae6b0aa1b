package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Canonical view of one webhook delivery, built by the normalizer and consumed immediately by the
 * state machine. Identifier fields are null when the payload did not carry them; amount is never null.
 */
@Value
@Builder
public class NormalizedPaymentEvent {

    /** Envelope id assigned by the gateway (same across redeliveries). */
    String eventId;
    String eventType;
    String eventDate;
    EventKind kind;
    String subscriptionId;
    String transactionId;
    BigDecimal amount;
    String customerEmail;
    String invoiceNumber;

    public boolean hasSubscriptionId() {
        return subscriptionId != null && !subscriptionId.isBlank();
    }

    public boolean hasTransactionId() {
        return transactionId != null && !transactionId.isBlank();
    }
}
