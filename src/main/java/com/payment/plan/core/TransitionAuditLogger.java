package com.payment.plan.core;

import com.payment.plan.domain.NormalizedPaymentEvent;
import com.payment.plan.domain.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit log lines for every webhook the state machine evaluates. Kept separate from the
 * diagnostic logging so the [AUDIT] stream can be routed to its own appender.
 */
@Slf4j
@Component
public class TransitionAuditLogger {

    public void logTransition(NormalizedPaymentEvent event, TransitionResult result) {
        log.info("[AUDIT] PLAN_TRANSITION eventId={} kind={} outcome={} reason={} planId={} subscriptionId={} transactionId={} paymentNumber={} planStatus={} healed={}",
                event.getEventId(),
                event.getKind(),
                result.getOutcome(),
                result.getSkipReason(),
                result.getPlanId(),
                event.getSubscriptionId(),
                event.getTransactionId(),
                result.getPaymentNumber(),
                result.getPlanStatus(),
                result.isHealed());
    }

    public void logFailure(NormalizedPaymentEvent event, Throwable error) {
        log.warn("[AUDIT] PLAN_TRANSITION_FAILED eventId={} kind={} subscriptionId={} transactionId={} error={}",
                event.getEventId(),
                event.getKind(),
                event.getSubscriptionId(),
                event.getTransactionId(),
                error.getMessage());
    }
}
