package com.payment.plan.core;

import com.payment.plan.api.ConcurrentPlanUpdateException;
import com.payment.plan.api.StorageFailureException;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.NormalizedPaymentEvent;
import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PaymentRecord;
import com.payment.plan.domain.PaymentRecordStatus;
import com.payment.plan.domain.Plan;
import com.payment.plan.domain.PlanStatus;
import com.payment.plan.domain.SkipReason;
import com.payment.plan.domain.TransitionOutcome;
import com.payment.plan.domain.TransitionResult;
import com.payment.plan.notification.NotificationDispatcher;
import com.payment.plan.persistence.store.PaymentRecordUpdate;
import com.payment.plan.persistence.store.PlanStore;
import com.payment.plan.persistence.store.PlanUpdate;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies normalized gateway events to payment plans.
 *
 * <p>All work for one subscription runs under {@link SubscriptionLockManager}; every write is
 * additionally guarded by a compare-and-swap in the {@link PlanStore}, and a lost race is retried
 * through the {@code plan-transition} Resilience4j retry, which re-reads the plan each attempt.
 *
 * <p>For a paid installment the record is marked paid before the plan counter moves. A crash between
 * the two writes leaves a paid record ahead of the counter; the gateway's redelivery of the same
 * transaction finds that record and only advances the counter.
 *
 * <p>Notifications are dispatched after the writes have committed and never affect the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanStateMachine {

    static final String RETRY_INSTANCE = "plan-transition";

    private final PlanStore planStore;
    private final SubscriptionLockManager lockManager;
    private final RetryRegistry retryRegistry;
    private final NotificationDispatcher notificationDispatcher;
    private final TransitionAuditLogger auditLogger;

    /**
     * @throws StorageFailureException when the store fails, or when concurrent updates kept winning
     *                                 after all retry attempts
     */
    public TransitionResult apply(NormalizedPaymentEvent event) {
        EventKind kind = event.getKind();
        if (kind == null || kind == EventKind.UNSUPPORTED) {
            log.info("Ignoring unsupported event type={}, eventId={}", event.getEventType(), event.getEventId());
            return finish(event, TransitionResult.skipped(EventKind.UNSUPPORTED, SkipReason.UNSUPPORTED_EVENT, null));
        }
        if (!event.hasSubscriptionId()) {
            log.warn("Event {} ({}) carries no subscription id; nothing to update", event.getEventId(), kind.getCode());
            return finish(event, TransitionResult.skipped(kind, SkipReason.MISSING_SUBSCRIPTION_ID, null));
        }

        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<TransitionResult> guarded =
                () -> lockManager.withLock(event.getSubscriptionId(), () -> transition(event));

        TransitionResult result;
        try {
            result = Retry.decorateSupplier(retry, guarded).get();
        } catch (StorageFailureException e) {
            auditLogger.logFailure(event, e);
            throw e;
        }

        finish(event, result);
        if (result.isApplied()) {
            notificationDispatcher.dispatch(result);
        }
        return result;
    }

    private TransitionResult finish(NormalizedPaymentEvent event, TransitionResult result) {
        auditLogger.logTransition(event, result);
        return result;
    }

    private TransitionResult transition(NormalizedPaymentEvent event) {
        switch (event.getKind()) {
            case INSTALLMENT_PAID:
                return installmentPaid(event);
            case PLAN_SUSPENDED:
                return planSuspended(event);
            case PLAN_CANCELLED:
                return planCancelled(event);
            default:
                return TransitionResult.skipped(event.getKind(), SkipReason.UNSUPPORTED_EVENT, null);
        }
    }

    private TransitionResult installmentPaid(NormalizedPaymentEvent event) {
        EventKind kind = EventKind.INSTALLMENT_PAID;
        Optional<Plan> found = planStore.findPlanBySubscriptionId(event.getSubscriptionId());
        if (found.isEmpty()) {
            log.info("No payment plan linked to subscriptionId={}", event.getSubscriptionId());
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_FOUND, null);
        }
        Plan plan = found.get();
        if (!plan.isPaymentPlan()) {
            return TransitionResult.skipped(kind, SkipReason.NOT_A_PAYMENT_PLAN, plan);
        }
        if (!plan.getStatus().acceptsPayments() && plan.getStatus() != PlanStatus.COMPLETED) {
            log.warn("Payment received for {} plan: planId={}, subscriptionId={}, transactionId={}",
                    plan.getStatus(), plan.getId(), plan.getSubscriptionId(), event.getTransactionId());
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_ACTIVE, plan);
        }

        List<PaymentRecord> records = planStore.listPaymentRecords(plan.getId());
        int completed = plan.getCompletedPayments();

        if (event.hasTransactionId()) {
            Optional<PaymentRecord> alreadyPaid = records.stream()
                    .filter(r -> r.isPaid() && event.getTransactionId().equals(r.getTransactionId()))
                    .findFirst();
            if (alreadyPaid.isPresent()) {
                int paidNumber = alreadyPaid.get().getPaymentNumber();
                if (paidNumber == completed + 1) {
                    log.warn("Counter behind paid record, advancing: planId={}, paymentNumber={}, transactionId={}",
                            plan.getId(), paidNumber, event.getTransactionId());
                    return advanceCounter(plan, paidNumber, event.getTransactionId(), true);
                }
                if (paidNumber > completed + 1) {
                    log.error("Paid record {} is more than one ahead of counter {} for planId={}; leaving plan unchanged",
                            paidNumber, completed, plan.getId());
                }
                log.info("Duplicate delivery of transactionId={} for planId={} (payment {})",
                        event.getTransactionId(), plan.getId(), paidNumber);
                return TransitionResult.skipped(kind, SkipReason.DUPLICATE_DELIVERY, plan);
            }
        }

        int next = completed + 1;
        if (next > plan.getInstallmentCount()) {
            log.warn("Extra payment for fully paid plan: planId={}, completed={}/{}, transactionId={}",
                    plan.getId(), completed, plan.getInstallmentCount(), event.getTransactionId());
            return TransitionResult.skipped(kind, SkipReason.INSTALLMENTS_EXHAUSTED, plan);
        }

        Optional<PaymentRecord> nextRecord = records.stream()
                .filter(r -> r.getPaymentNumber() == next)
                .findFirst();
        if (nextRecord.isEmpty()) {
            log.error("Payment record {} missing for planId={}; plan left unchanged", next, plan.getId());
            return TransitionResult.skipped(kind, SkipReason.PAYMENT_RECORD_MISSING, plan);
        }

        PaymentRecord record = nextRecord.get();
        if (record.isPaid()) {
            if (record.getTransactionId() == null || record.getTransactionId().isBlank()) {
                if (event.getTransactionId() != null && !event.getTransactionId().isBlank()) {
                    planStore.updatePaymentRecord(plan.getId(), next, PaymentRecordUpdate.builder()
                            .expectedStatus(PaymentRecordStatus.PAID)
                            .transactionId(event.getTransactionId())
                            .build());
                }
                return advanceCounter(plan, next, event.getTransactionId(), true);
            }
            throw new ConcurrentPlanUpdateException(String.format(
                    "Payment %d of plan %s already paid by transaction %s", next, plan.getId(), record.getTransactionId()));
        }

        planStore.updatePaymentRecord(plan.getId(), next, PaymentRecordUpdate.builder()
                .status(PaymentRecordStatus.PAID)
                .expectedStatus(record.getStatus())
                .transactionId(event.getTransactionId())
                .paidAt(Instant.now())
                .build());

        return advanceCounter(plan, next, event.getTransactionId(), false);
    }

    private TransitionResult advanceCounter(Plan plan, int paymentNumber, String transactionId, boolean healed) {
        boolean complete = paymentNumber >= plan.getInstallmentCount();
        PlanUpdate.PlanUpdateBuilder update = PlanUpdate.builder()
                .completedPayments(paymentNumber)
                .expectedCompletedPayments(plan.getCompletedPayments())
                .status(complete ? PlanStatus.COMPLETED : PlanStatus.ACTIVE);
        if (complete) {
            update.orderPaymentStatus(OrderPaymentStatus.PAID)
                    .orderPaidAt(Instant.now())
                    .orderTransactionId(transactionId);
        }
        Plan updated = planStore.updatePlan(plan.getId(), update.build());

        if (complete) {
            log.info("Payment plan completed: planId={}, orderReference={}, payments={}/{}",
                    updated.getId(), updated.getOrderReference(), paymentNumber, updated.getInstallmentCount());
        } else {
            log.info("Installment recorded: planId={}, payment {}/{}, transactionId={}",
                    updated.getId(), paymentNumber, updated.getInstallmentCount(), transactionId);
        }
        return applied(EventKind.INSTALLMENT_PAID, updated, paymentNumber, healed);
    }

    private TransitionResult planSuspended(NormalizedPaymentEvent event) {
        EventKind kind = EventKind.PLAN_SUSPENDED;
        Optional<Plan> found = planStore.findPlanBySubscriptionId(event.getSubscriptionId());
        if (found.isEmpty()) {
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_FOUND, null);
        }
        Plan plan = found.get();
        if (!plan.isPaymentPlan()) {
            return TransitionResult.skipped(kind, SkipReason.NOT_A_PAYMENT_PLAN, plan);
        }
        if (plan.getStatus() == PlanStatus.SUSPENDED) {
            return TransitionResult.skipped(kind, SkipReason.ALREADY_IN_STATE, plan);
        }
        if (plan.getStatus() == PlanStatus.COMPLETED || plan.getStatus() == PlanStatus.CANCELLED) {
            log.warn("Suspension received for {} plan: planId={}", plan.getStatus(), plan.getId());
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_ACTIVE, plan);
        }

        int failedNumber = plan.getCompletedPayments() + 1;
        Integer failedPayment = null;
        if (failedNumber <= plan.getInstallmentCount()) {
            Optional<PaymentRecord> record = planStore.listPaymentRecords(plan.getId()).stream()
                    .filter(r -> r.getPaymentNumber() == failedNumber)
                    .findFirst();
            if (record.isPresent() && !record.get().isPaid()) {
                planStore.updatePaymentRecord(plan.getId(), failedNumber, PaymentRecordUpdate.builder()
                        .status(PaymentRecordStatus.FAILED)
                        .expectedStatus(record.get().getStatus())
                        .failedAt(Instant.now())
                        .build());
                failedPayment = failedNumber;
            } else if (record.isEmpty()) {
                log.error("Payment record {} missing for suspended planId={}", failedNumber, plan.getId());
            }
        }

        Plan updated = planStore.updatePlan(plan.getId(), PlanUpdate.builder()
                .status(PlanStatus.SUSPENDED)
                .expectedCompletedPayments(plan.getCompletedPayments())
                .build());
        log.warn("Payment plan suspended: planId={}, subscriptionId={}, failedPayment={}",
                updated.getId(), updated.getSubscriptionId(), failedPayment);
        return applied(kind, updated, failedPayment, false);
    }

    private TransitionResult planCancelled(NormalizedPaymentEvent event) {
        EventKind kind = EventKind.PLAN_CANCELLED;
        Optional<Plan> found = planStore.findPlanBySubscriptionId(event.getSubscriptionId());
        if (found.isEmpty()) {
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_FOUND, null);
        }
        Plan plan = found.get();
        if (!plan.isPaymentPlan()) {
            return TransitionResult.skipped(kind, SkipReason.NOT_A_PAYMENT_PLAN, plan);
        }
        if (plan.getStatus() == PlanStatus.CANCELLED) {
            return TransitionResult.skipped(kind, SkipReason.ALREADY_IN_STATE, plan);
        }
        if (plan.getStatus() == PlanStatus.COMPLETED) {
            log.info("Cancellation after completion ignored: planId={}", plan.getId());
            return TransitionResult.skipped(kind, SkipReason.PLAN_NOT_ACTIVE, plan);
        }

        Plan updated = planStore.updatePlan(plan.getId(), PlanUpdate.builder()
                .status(PlanStatus.CANCELLED)
                .expectedCompletedPayments(plan.getCompletedPayments())
                .build());
        log.warn("Payment plan cancelled: planId={}, subscriptionId={}, completed={}/{}",
                updated.getId(), updated.getSubscriptionId(), updated.getCompletedPayments(), updated.getInstallmentCount());
        return applied(kind, updated, null, false);
    }

    private static TransitionResult applied(EventKind kind, Plan plan, Integer paymentNumber, boolean healed) {
        return TransitionResult.builder()
                .outcome(TransitionOutcome.APPLIED)
                .kind(kind)
                .planId(plan.getId())
                .orderReference(plan.getOrderReference())
                .paymentNumber(paymentNumber)
                .totalPayments(plan.getInstallmentCount())
                .planStatus(plan.getStatus())
                .planCompleted(plan.getStatus() == PlanStatus.COMPLETED)
                .healed(healed)
                .plan(plan)
                .build();
    }
}
