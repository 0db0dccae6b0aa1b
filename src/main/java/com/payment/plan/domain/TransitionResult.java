package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What the state machine did with one normalized event.
 */
@Value
@Builder
public class TransitionResult {

    TransitionOutcome outcome;
    EventKind kind;
    SkipReason skipReason;
    String planId;
    String orderReference;
    Integer paymentNumber;
    Integer totalPayments;
    PlanStatus planStatus;
    boolean planCompleted;
    /** True when the counter was re-bumped to an already-paid record (crash recovery). */
    boolean healed;
    /** Plan snapshot after the transition, or as read when skipped. */
    Plan plan;

    public static TransitionResult skipped(EventKind kind, SkipReason reason, Plan plan) {
        return TransitionResult.builder()
                .outcome(TransitionOutcome.SKIPPED)
                .kind(kind)
                .skipReason(reason)
                .planId(plan != null ? plan.getId() : null)
                .orderReference(plan != null ? plan.getOrderReference() : null)
                .planStatus(plan != null ? plan.getStatus() : null)
                .plan(plan)
                .build();
    }

    public boolean isApplied() {
        return outcome == TransitionOutcome.APPLIED;
    }
}
