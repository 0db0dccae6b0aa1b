package com.payment.plan.normalization;

import com.payment.plan.domain.EventKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps gateway event type strings onto {@link EventKind}. Exact names win; otherwise the type is
 * matched case-insensitively against keyword groups in order. Refunds, voids, declines and fraud
 * holds are listed explicitly as unsupported so the "pay" keyword cannot claim them.
 */
@Component
public class EventKindClassifier {

    private static final Map<String, EventKind> KNOWN_TYPES = Map.ofEntries(
            Map.entry("net.authorize.payment.authcapture.created", EventKind.INSTALLMENT_PAID),
            Map.entry("net.authorize.payment.capture.created", EventKind.INSTALLMENT_PAID),
            Map.entry("net.authorize.payment.priorAuthCapture.created", EventKind.INSTALLMENT_PAID),
            Map.entry("invoicing.customer.invoice.paid", EventKind.INSTALLMENT_PAID),
            Map.entry("net.authorize.invoice.paid", EventKind.INSTALLMENT_PAID),
            Map.entry("net.authorize.customer.subscription.suspended", EventKind.PLAN_SUSPENDED),
            Map.entry("net.authorize.customer.subscription.cancelled", EventKind.PLAN_CANCELLED),
            Map.entry("net.authorize.customer.subscription.terminated", EventKind.PLAN_CANCELLED),
            Map.entry("invoicing.customer.invoice.cancel", EventKind.PLAN_CANCELLED),
            Map.entry("net.authorize.customer.subscription.created", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.customer.subscription.updated", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.customer.subscription.expiring", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.authcapture.failed", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.authorization.created", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.refund.created", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.void.created", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.fraud.held", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.fraud.approved", EventKind.UNSUPPORTED),
            Map.entry("net.authorize.payment.fraud.declined", EventKind.UNSUPPORTED),
            Map.entry("invoicing.customer.invoice.partial-payment", EventKind.UNSUPPORTED),
            Map.entry("invoicing.customer.invoice.overdue-reminder", EventKind.UNSUPPORTED),
            Map.entry("invoicing.customer.invoice.reminder", EventKind.UNSUPPORTED));

    private static final List<KeywordGroup> KEYWORD_GROUPS = List.of(
            new KeywordGroup(EventKind.PLAN_SUSPENDED, List.of("suspend")),
            new KeywordGroup(EventKind.PLAN_CANCELLED, List.of("cancel", "terminat")),
            new KeywordGroup(EventKind.INSTALLMENT_PAID, List.of("paid", "pay")));

    public EventKind classify(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return EventKind.UNSUPPORTED;
        }
        String trimmed = eventType.trim();
        EventKind known = KNOWN_TYPES.get(trimmed);
        if (known != null) {
            return known;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (KeywordGroup group : KEYWORD_GROUPS) {
            if (group.matches(lower)) {
                return group.kind;
            }
        }
        return EventKind.UNSUPPORTED;
    }

    private static final class KeywordGroup {
        private final EventKind kind;
        private final List<String> keywords;

        private KeywordGroup(EventKind kind, List<String> keywords) {
            this.kind = kind;
            this.keywords = keywords;
        }

        private boolean matches(String lowerEventType) {
            return keywords.stream().anyMatch(lowerEventType::contains);
        }
    }
}
