package com.payment.plan.core;

import com.payment.plan.api.PlanNotFoundException;
import com.payment.plan.api.PlanStateConflictException;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.InstallmentSchedule;
import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PaymentRecord;
import com.payment.plan.domain.PaymentRecordStatus;
import com.payment.plan.domain.Plan;
import com.payment.plan.domain.PlanDetails;
import com.payment.plan.domain.PlanStatus;
import com.payment.plan.domain.PlanValidationResult;
import com.payment.plan.domain.TransitionOutcome;
import com.payment.plan.domain.TransitionResult;
import com.payment.plan.notification.NotificationDispatcher;
import com.payment.plan.persistence.store.PaymentRecordUpdate;
import com.payment.plan.persistence.store.PlanStore;
import com.payment.plan.persistence.store.PlanUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plan lifecycle operations driven by the checkout flow: creating a plan, linking the gateway
 * subscription once the first charge succeeded, and reading plan progress.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentPlanService {

    private final PlanStore planStore;
    private final InstallmentCalculator installmentCalculator;
    private final SubscriptionLockManager lockManager;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Creates a pending plan with one record per installment. The first record carries the rounding
     * remainder.
     *
     * @throws com.payment.plan.api.InvalidPlanParametersException on a bad total or installment count
     */
    public PlanDetails createPlan(String orderReference, BigDecimal totalAmount, Integer installments, String customerEmail) {
        InstallmentSchedule schedule = installmentCalculator.computeSchedule(totalAmount, installments);

        Plan plan = planStore.insertPlan(Plan.builder()
                .orderReference(orderReference)
                .paymentPlan(true)
                .totalAmount(schedule.getTotalAmount())
                .installmentCount(schedule.getInstallments())
                .installmentAmount(schedule.getRecurringAmount())
                .completedPayments(0)
                .status(PlanStatus.PENDING)
                .customerEmail(customerEmail)
                .orderPaymentStatus(OrderPaymentStatus.UNPAID)
                .build());

        List<PaymentRecord> records = new ArrayList<>(schedule.getInstallments());
        for (int n = 1; n <= schedule.getInstallments(); n++) {
            records.add(PaymentRecord.builder()
                    .planId(plan.getId())
                    .paymentNumber(n)
                    .totalPayments(schedule.getInstallments())
                    .amount(schedule.amountFor(n))
                    .status(PaymentRecordStatus.PENDING)
                    .build());
        }
        List<PaymentRecord> created = planStore.createPaymentRecords(plan.getId(), records);

        log.info("Created payment plan: planId={}, orderReference={}, total={}, installments={}, first={}, recurring={}",
                plan.getId(), orderReference, schedule.getTotalAmount(), schedule.getInstallments(),
                schedule.getFirstPayment(), schedule.getRecurringAmount());
        return new PlanDetails(plan, created);
    }

    /**
     * Records the immediate first charge and links the gateway subscription that will bill the
     * remaining installments. Repeating the call with the same transaction is a no-op.
     *
     * @throws PlanNotFoundException when no plan has this id
     * @throws PlanStateConflictException when the plan is not pending, or the first payment was recorded
     *                               with a different transaction or subscription
     */
    public PlanDetails markFirstPaymentComplete(String planId, String transactionId, String subscriptionId) {
        Plan plan = planStore.findPlanById(planId).orElseThrow(() -> new PlanNotFoundException(planId));
        String lockKey = subscriptionId != null ? subscriptionId : planId;

        Plan linked = lockManager.withLock(lockKey, () -> linkFirstPayment(planId, transactionId, subscriptionId));
        if (linked == null) {
            return getPlanStatus(plan.getId());
        }

        notificationDispatcher.dispatch(TransitionResult.builder()
                .outcome(TransitionOutcome.APPLIED)
                .kind(EventKind.INSTALLMENT_PAID)
                .planId(linked.getId())
                .orderReference(linked.getOrderReference())
                .paymentNumber(1)
                .totalPayments(linked.getInstallmentCount())
                .planStatus(linked.getStatus())
                .plan(linked)
                .build());
        return getPlanStatus(linked.getId());
    }

    /** Returns the updated plan, or null when the first payment was already recorded. */
    private Plan linkFirstPayment(String planId, String transactionId, String subscriptionId) {
        Plan plan = planStore.findPlanById(planId).orElseThrow(() -> new PlanNotFoundException(planId));
        PaymentRecord first = planStore.listPaymentRecords(planId).stream()
                .filter(r -> r.getPaymentNumber() == 1)
                .findFirst()
                .orElseThrow(() -> new PlanStateConflictException("Payment plan " + planId + " has no first payment record"));

        if (first.isPaid()) {
            boolean sameTransaction = transactionId != null && transactionId.equals(first.getTransactionId());
            boolean sameSubscription = subscriptionId == null || subscriptionId.equals(plan.getSubscriptionId());
            if (sameTransaction && sameSubscription) {
                log.info("First payment already recorded: planId={}, transactionId={}", planId, transactionId);
                return null;
            }
            throw new PlanStateConflictException("First payment of plan " + planId + " was already recorded with transaction "
                    + first.getTransactionId());
        }
        if (plan.getStatus() != PlanStatus.PENDING) {
            throw new PlanStateConflictException("Payment plan " + planId + " is " + plan.getStatus() + ", expected PENDING");
        }
        if (subscriptionId != null) {
            Optional<Plan> owner = planStore.findPlanBySubscriptionId(subscriptionId);
            if (owner.isPresent() && !owner.get().getId().equals(planId)) {
                throw new PlanStateConflictException("Subscription " + subscriptionId + " is already linked to plan "
                        + owner.get().getId());
            }
        }

        planStore.updatePaymentRecord(planId, 1, PaymentRecordUpdate.builder()
                .status(PaymentRecordStatus.PAID)
                .expectedStatus(first.getStatus())
                .transactionId(transactionId)
                .paidAt(Instant.now())
                .build());
        Plan updated = planStore.updatePlan(planId, PlanUpdate.builder()
                .completedPayments(1)
                .expectedCompletedPayments(plan.getCompletedPayments())
                .status(PlanStatus.ACTIVE)
                .subscriptionId(subscriptionId)
                .build());

        log.info("First payment recorded: planId={}, transactionId={}, subscriptionId={}",
                planId, transactionId, subscriptionId);
        return updated;
    }

    public PlanDetails getPlanStatus(String planId) {
        Plan plan = planStore.findPlanById(planId).orElseThrow(() -> new PlanNotFoundException(planId));
        return new PlanDetails(plan, planStore.listPaymentRecords(planId));
    }

    public PlanValidationResult validate(BigDecimal totalAmount, Integer installments) {
        return installmentCalculator.validate(totalAmount, installments);
    }
}
