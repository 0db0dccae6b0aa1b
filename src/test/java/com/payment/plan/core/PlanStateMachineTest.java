package com.payment.plan.core;

import com.payment.plan.api.ConcurrentPlanUpdateException;
import com.payment.plan.api.StorageFailureException;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.NormalizedPaymentEvent;
import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PaymentRecordStatus;
import com.payment.plan.domain.Plan;
import com.payment.plan.domain.PlanStatus;
import com.payment.plan.domain.SkipReason;
import com.payment.plan.domain.TransitionOutcome;
import com.payment.plan.domain.TransitionResult;
import com.payment.plan.notification.NotificationDispatcher;
import com.payment.plan.persistence.store.InMemoryPlanStore;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * State machine behaviour against an in-memory store: redeliveries, terminal states, concurrency and
 * partial-write recovery.
 */
@ExtendWith(MockitoExtension.class)
class PlanStateMachineTest {

    private static final String SUB = "SUB-42";

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private InMemoryPlanStore store;
    private PlanStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        store = new InMemoryPlanStore();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ConcurrentPlanUpdateException.class)
                .build());
        stateMachine = new PlanStateMachine(store, new SubscriptionLockManager(), retryRegistry,
                notificationDispatcher, new TransitionAuditLogger());
    }

    private static NormalizedPaymentEvent paid(String subscriptionId, String transactionId) {
        return NormalizedPaymentEvent.builder()
                .eventId("evt-" + transactionId)
                .eventType("net.authorize.payment.authcapture.created")
                .kind(EventKind.INSTALLMENT_PAID)
                .subscriptionId(subscriptionId)
                .transactionId(transactionId)
                .amount(new BigDecimal("100.00"))
                .customerEmail("")
                .build();
    }

    private static NormalizedPaymentEvent management(EventKind kind, String subscriptionId) {
        return NormalizedPaymentEvent.builder()
                .eventId("evt-" + kind)
                .eventType("net.authorize.customer.subscription." + kind.getCode())
                .kind(kind)
                .subscriptionId(subscriptionId)
                .amount(BigDecimal.ZERO.setScale(2))
                .customerEmail("")
                .build();
    }

    @Test
    void installmentPaidMarksRecordAndAdvancesCounter() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(result.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(result.getPaymentNumber()).isEqualTo(2);
        assertThat(result.isPlanCompleted()).isFalse();
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(2);
        assertThat(store.plan(plan.getId()).getStatus()).isEqualTo(PlanStatus.ACTIVE);
        assertThat(store.record(plan.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.PAID);
        assertThat(store.record(plan.getId(), 2).getTransactionId()).isEqualTo("tx-2");
        assertThat(store.record(plan.getId(), 2).getPaidAt()).isNotNull();
        verify(notificationDispatcher).dispatch(result);
    }

    @Test
    void finalInstallmentCompletesPlanAndOrder() {
        Plan plan = store.seed(SUB, 3, 2, PlanStatus.ACTIVE);

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-3"));

        Plan stored = store.plan(plan.getId());
        assertThat(result.isPlanCompleted()).isTrue();
        assertThat(stored.getStatus()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(stored.getCompletedPayments()).isEqualTo(3);
        assertThat(stored.getOrderPaymentStatus()).isEqualTo(OrderPaymentStatus.PAID);
        assertThat(stored.getOrderPaidAt()).isNotNull();
        assertThat(stored.getOrderTransactionId()).isEqualTo("tx-3");
    }

    @Test
    void redeliveryOfSameTransactionChangesNothing() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        stateMachine.apply(paid(SUB, "tx-2"));
        Plan afterFirst = store.plan(plan.getId());
        int planWrites = store.planWrites();
        int recordWrites = store.recordWrites();

        TransitionResult second = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(second.getOutcome()).isEqualTo(TransitionOutcome.SKIPPED);
        assertThat(second.getSkipReason()).isEqualTo(SkipReason.DUPLICATE_DELIVERY);
        assertThat(store.plan(plan.getId())).isEqualTo(afterFirst);
        assertThat(store.planWrites()).isEqualTo(planWrites);
        assertThat(store.recordWrites()).isEqualTo(recordWrites);
        verify(notificationDispatcher, times(1)).dispatch(any());
    }

    @Test
    void completedPlanIgnoresFurtherPayments() {
        Plan plan = store.seed(SUB, 3, 3, PlanStatus.COMPLETED);

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-extra"));

        assertThat(result.getSkipReason()).isEqualTo(SkipReason.INSTALLMENTS_EXHAUSTED);
        assertThat(store.plan(plan.getId())).isEqualTo(plan);
        assertThat(store.planWrites()).isZero();
        assertThat(store.recordWrites()).isZero();
        verify(notificationDispatcher, never()).dispatch(any());
    }

    @Test
    void concurrentDistinctPaymentsAreAllCounted() throws Exception {
        Plan plan = store.seed(SUB, 12, 1, PlanStatus.ACTIVE);
        int payments = 8;
        ExecutorService pool = Executors.newFixedThreadPool(payments);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransitionResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < payments; i++) {
                String tx = "tx-concurrent-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return stateMachine.apply(paid(SUB, tx));
                }));
            }
            start.countDown();
            for (Future<TransitionResult> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
            }
        } finally {
            pool.shutdownNow();
        }

        Plan stored = store.plan(plan.getId());
        assertThat(stored.getCompletedPayments()).isEqualTo(1 + payments);
        Set<String> transactions = new HashSet<>();
        for (int n = 2; n <= 1 + payments; n++) {
            assertThat(store.record(plan.getId(), n).getStatus()).isEqualTo(PaymentRecordStatus.PAID);
            transactions.add(store.record(plan.getId(), n).getTransactionId());
        }
        assertThat(transactions).hasSize(payments);
        assertThat(store.record(plan.getId(), 2 + payments).getStatus()).isEqualTo(PaymentRecordStatus.PENDING);
    }

    @Test
    void suspensionFailsNextRecordAndBlocksLaterPayments() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);

        TransitionResult suspended = stateMachine.apply(management(EventKind.PLAN_SUSPENDED, SUB));

        assertThat(suspended.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(suspended.getPaymentNumber()).isEqualTo(2);
        assertThat(store.plan(plan.getId()).getStatus()).isEqualTo(PlanStatus.SUSPENDED);
        assertThat(store.record(plan.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.FAILED);
        assertThat(store.record(plan.getId(), 2).getFailedAt()).isNotNull();

        TransitionResult payment = stateMachine.apply(paid(SUB, "tx-late"));

        assertThat(payment.getSkipReason()).isEqualTo(SkipReason.PLAN_NOT_ACTIVE);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(1);
        assertThat(store.record(plan.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.FAILED);
    }

    @Test
    void repeatedSuspensionIsNoOp() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        stateMachine.apply(management(EventKind.PLAN_SUSPENDED, SUB));
        Plan afterFirst = store.plan(plan.getId());

        TransitionResult again = stateMachine.apply(management(EventKind.PLAN_SUSPENDED, SUB));

        assertThat(again.getSkipReason()).isEqualTo(SkipReason.ALREADY_IN_STATE);
        assertThat(store.plan(plan.getId())).isEqualTo(afterFirst);
    }

    @Test
    void cancellationLeavesRecordsUntouched() {
        Plan plan = store.seed(SUB, 4, 2, PlanStatus.ACTIVE);

        TransitionResult result = stateMachine.apply(management(EventKind.PLAN_CANCELLED, SUB));

        assertThat(result.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(store.plan(plan.getId()).getStatus()).isEqualTo(PlanStatus.CANCELLED);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(2);
        assertThat(store.record(plan.getId(), 3).getStatus()).isEqualTo(PaymentRecordStatus.PENDING);
        assertThat(stateMachine.apply(paid(SUB, "tx-after-cancel")).getSkipReason())
                .isEqualTo(SkipReason.PLAN_NOT_ACTIVE);
    }

    @Test
    void suspendedPlanCanBeCancelled() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.SUSPENDED);

        TransitionResult result = stateMachine.apply(management(EventKind.PLAN_CANCELLED, SUB));

        assertThat(result.isApplied()).isTrue();
        assertThat(store.plan(plan.getId()).getStatus()).isEqualTo(PlanStatus.CANCELLED);
    }

    @Test
    void completedPlanIsNotCancelled() {
        Plan plan = store.seed(SUB, 3, 3, PlanStatus.COMPLETED);

        TransitionResult result = stateMachine.apply(management(EventKind.PLAN_CANCELLED, SUB));

        assertThat(result.getSkipReason()).isEqualTo(SkipReason.PLAN_NOT_ACTIVE);
        assertThat(store.plan(plan.getId()).getStatus()).isEqualTo(PlanStatus.COMPLETED);
    }

    @Test
    void unknownSubscriptionIsSkipped() {
        TransitionResult result = stateMachine.apply(paid("SUB-unknown", "tx-1"));

        assertThat(result.getOutcome()).isEqualTo(TransitionOutcome.SKIPPED);
        assertThat(result.getSkipReason()).isEqualTo(SkipReason.PLAN_NOT_FOUND);
        assertThat(result.getPlanId()).isNull();
    }

    @Test
    void ordinaryOrderIsSkipped() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.replacePlan(plan.toBuilder().paymentPlan(false).build());

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(result.getSkipReason()).isEqualTo(SkipReason.NOT_A_PAYMENT_PLAN);
        assertThat(store.planWrites()).isZero();
    }

    @Test
    void eventsWithoutSubscriptionOrOfUnsupportedKindAreSkipped() {
        store.seed(SUB, 3, 1, PlanStatus.ACTIVE);

        TransitionResult noSubscription = stateMachine.apply(paid(null, "tx-2"));
        TransitionResult unsupported = stateMachine.apply(NormalizedPaymentEvent.builder()
                .eventType("net.authorize.payment.refund.created")
                .kind(EventKind.UNSUPPORTED)
                .subscriptionId(SUB)
                .amount(BigDecimal.ZERO.setScale(2))
                .build());

        assertThat(noSubscription.getSkipReason()).isEqualTo(SkipReason.MISSING_SUBSCRIPTION_ID);
        assertThat(unsupported.getSkipReason()).isEqualTo(SkipReason.UNSUPPORTED_EVENT);
        assertThat(store.planWrites()).isZero();
        assertThat(store.recordWrites()).isZero();
    }

    @Test
    void missingPaymentRecordIsSkipped() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.removeRecord(plan.getId(), 2);

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(result.getSkipReason()).isEqualTo(SkipReason.PAYMENT_RECORD_MISSING);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(1);
    }

    @Test
    void storageFailurePropagatesWithoutNotifying() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.failNext("updatePaymentRecord", 1);

        assertThatThrownBy(() -> stateMachine.apply(paid(SUB, "tx-2")))
                .isInstanceOf(StorageFailureException.class)
                .isNotInstanceOf(ConcurrentPlanUpdateException.class);

        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(1);
        assertThat(store.record(plan.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.PENDING);
        verify(notificationDispatcher, never()).dispatch(any());
    }

    @Test
    void redeliveryAfterFailureBetweenWritesAdvancesCounterOnce() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.failNext("updatePlan", 1);

        assertThatThrownBy(() -> stateMachine.apply(paid(SUB, "tx-2")))
                .isInstanceOf(StorageFailureException.class);
        assertThat(store.record(plan.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.PAID);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(1);

        TransitionResult healed = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(healed.isApplied()).isTrue();
        assertThat(healed.isHealed()).isTrue();
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(2);
        assertThat(stateMachine.apply(paid(SUB, "tx-2")).getSkipReason()).isEqualTo(SkipReason.DUPLICATE_DELIVERY);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(2);
    }

    @Test
    void paidRecordWithoutTransactionIsHealedAndGetsTheChargeId() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.replaceRecord(store.record(plan.getId(), 2).toBuilder()
                .status(PaymentRecordStatus.PAID)
                .transactionId(null)
                .build());

        TransitionResult result = stateMachine.apply(paid(SUB, "tx-2"));

        assertThat(result.isApplied()).isTrue();
        assertThat(result.isHealed()).isTrue();
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(2);
        assertThat(store.record(plan.getId(), 2).getTransactionId()).isEqualTo("tx-2");
        assertThat(stateMachine.apply(paid(SUB, "tx-2")).getSkipReason()).isEqualTo(SkipReason.DUPLICATE_DELIVERY);
    }

    @Test
    void recordPaidByOtherTransactionIsReportedAsConcurrentUpdate() {
        Plan plan = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        store.replaceRecord(store.record(plan.getId(), 2).toBuilder()
                .status(PaymentRecordStatus.PAID)
                .transactionId("tx-other")
                .build());

        assertThatThrownBy(() -> stateMachine.apply(paid(SUB, "tx-2")))
                .isInstanceOf(ConcurrentPlanUpdateException.class);
        assertThat(store.plan(plan.getId()).getCompletedPayments()).isEqualTo(1);
    }

    @Test
    void otherPlansAreUnaffected() {
        Plan target = store.seed(SUB, 3, 1, PlanStatus.ACTIVE);
        Plan other = store.seed("SUB-other", 3, 1, PlanStatus.ACTIVE);

        stateMachine.apply(paid(SUB, "tx-2"));
        stateMachine.apply(management(EventKind.PLAN_SUSPENDED, SUB));

        assertThat(store.plan(target.getId()).getStatus()).isEqualTo(PlanStatus.SUSPENDED);
        assertThat(store.plan(other.getId())).isEqualTo(other);
        assertThat(store.record(other.getId(), 2).getStatus()).isEqualTo(PaymentRecordStatus.PENDING);
    }
}
