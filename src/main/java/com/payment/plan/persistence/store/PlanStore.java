package com.payment.plan.persistence.store;

import com.payment.plan.domain.PaymentRecord;
import com.payment.plan.domain.Plan;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for plans and their installments. Every method either succeeds or throws
 * {@link com.payment.plan.api.StorageFailureException}; compare-and-swap losses throw its
 * subclass {@link com.payment.plan.api.ConcurrentPlanUpdateException}.
 */
public interface PlanStore {

    Optional<Plan> findPlanBySubscriptionId(String subscriptionId);

    Optional<Plan> findPlanById(String planId);

    /** Inserts a new plan; assigns an id when the plan has none. */
    Plan insertPlan(Plan plan);

    /**
     * Applies the non-null fields of {@code update}. When {@link PlanUpdate#getExpectedCompletedPayments()}
     * is set, the write only happens if the stored counter still equals it.
     */
    Plan updatePlan(String planId, PlanUpdate update);

    List<PaymentRecord> createPaymentRecords(String planId, List<PaymentRecord> records);

    /**
     * Applies the non-null fields of {@code update} to installment {@code paymentNumber}. When
     * {@link PaymentRecordUpdate#getExpectedStatus()} is set, the write only happens if the stored
     * status still equals it.
     */
    PaymentRecord updatePaymentRecord(String planId, int paymentNumber, PaymentRecordUpdate update);

    /** Installments ordered by payment number. */
    List<PaymentRecord> listPaymentRecords(String planId);
}
