package com.payment.plan.persistence.store;

import com.payment.plan.api.ConcurrentPlanUpdateException;
import com.payment.plan.api.StorageFailureException;
import com.payment.plan.domain.OrderPaymentStatus;
import com.payment.plan.domain.PaymentRecord;
import com.payment.plan.domain.Plan;
import com.payment.plan.persistence.entity.PaymentRecordEntity;
import com.payment.plan.persistence.entity.PlanEntity;
import com.payment.plan.persistence.repository.PaymentRecordRepository;
import com.payment.plan.persistence.repository.PlanRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link PlanStore} on Spring Data JPA. Each operation runs in its own transaction; persistence
 * errors are translated to {@link StorageFailureException}, optimistic-lock and compare-and-swap
 * losses to {@link ConcurrentPlanUpdateException}.
 */
@Slf4j
@Component
public class JpaPlanStore implements PlanStore {

    private final PlanRepository planRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaPlanStore(PlanRepository planRepository,
                        PaymentRecordRepository paymentRecordRepository,
                        PlatformTransactionManager transactionManager) {
        this.planRepository = planRepository;
        this.paymentRecordRepository = paymentRecordRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<Plan> findPlanBySubscriptionId(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            return Optional.empty();
        }
        return inTransaction("findPlanBySubscriptionId", () ->
                planRepository.findBySubscriptionId(subscriptionId).map(JpaPlanStore::toDomain));
    }

    @Override
    public Optional<Plan> findPlanById(String planId) {
        if (planId == null || planId.isBlank()) {
            return Optional.empty();
        }
        return inTransaction("findPlanById", () -> planRepository.findById(planId).map(JpaPlanStore::toDomain));
    }

    @Override
    public Plan insertPlan(Plan plan) {
        return inTransaction("insertPlan", () -> {
            PlanEntity entity = PlanEntity.builder()
                    .id(plan.getId() != null ? plan.getId() : UUID.randomUUID().toString())
                    .orderReference(plan.getOrderReference())
                    .paymentPlan(plan.isPaymentPlan())
                    .totalAmount(plan.getTotalAmount())
                    .installmentCount(plan.getInstallmentCount())
                    .installmentAmount(plan.getInstallmentAmount())
                    .subscriptionId(plan.getSubscriptionId())
                    .completedPayments(plan.getCompletedPayments())
                    .status(plan.getStatus())
                    .customerEmail(plan.getCustomerEmail())
                    .orderPaymentStatus(plan.getOrderPaymentStatus() != null
                            ? plan.getOrderPaymentStatus() : OrderPaymentStatus.UNPAID)
                    .orderPaidAt(plan.getOrderPaidAt())
                    .orderTransactionId(plan.getOrderTransactionId())
                    .build();
            PlanEntity saved = planRepository.saveAndFlush(entity);
            log.debug("Inserted payment plan: planId={}, installments={}, total={}",
                    saved.getId(), saved.getInstallmentCount(), saved.getTotalAmount());
            return toDomain(saved);
        });
    }

    @Override
    public Plan updatePlan(String planId, PlanUpdate update) {
        return inTransaction("updatePlan", () -> {
            PlanEntity entity = planRepository.findById(planId)
                    .orElseThrow(() -> new StorageFailureException("Plan " + planId + " no longer exists"));

            if (update.getExpectedCompletedPayments() != null
                    && entity.getCompletedPayments() != update.getExpectedCompletedPayments()) {
                throw new ConcurrentPlanUpdateException(String.format(
                        "Plan %s completedPayments changed concurrently: expected=%d, actual=%d",
                        planId, update.getExpectedCompletedPayments(), entity.getCompletedPayments()));
            }

            if (update.getStatus() != null) {
                entity.setStatus(update.getStatus());
            }
            if (update.getCompletedPayments() != null) {
                entity.setCompletedPayments(update.getCompletedPayments());
            }
            if (update.getSubscriptionId() != null) {
                entity.setSubscriptionId(update.getSubscriptionId());
            }
            if (update.getOrderPaymentStatus() != null) {
                entity.setOrderPaymentStatus(update.getOrderPaymentStatus());
            }
            if (update.getOrderPaidAt() != null) {
                entity.setOrderPaidAt(update.getOrderPaidAt());
            }
            if (update.getOrderTransactionId() != null) {
                entity.setOrderTransactionId(update.getOrderTransactionId());
            }

            PlanEntity saved = planRepository.saveAndFlush(entity);
            log.debug("Updated payment plan: planId={}, status={}, completedPayments={}",
                    planId, saved.getStatus(), saved.getCompletedPayments());
            return toDomain(saved);
        });
    }

    @Override
    public List<PaymentRecord> createPaymentRecords(String planId, List<PaymentRecord> records) {
        return inTransaction("createPaymentRecords", () -> {
            List<PaymentRecordEntity> entities = new ArrayList<>(records.size());
            for (PaymentRecord record : records) {
                entities.add(PaymentRecordEntity.builder()
                        .id(UUID.randomUUID().toString())
                        .planId(planId)
                        .paymentNumber(record.getPaymentNumber())
                        .totalPayments(record.getTotalPayments())
                        .amount(record.getAmount())
                        .status(record.getStatus())
                        .transactionId(record.getTransactionId())
                        .paidAt(record.getPaidAt())
                        .failedAt(record.getFailedAt())
                        .build());
            }
            List<PaymentRecordEntity> saved = paymentRecordRepository.saveAllAndFlush(entities);
            log.debug("Created {} payment records for planId={}", saved.size(), planId);
            return saved.stream().map(JpaPlanStore::toDomain).collect(Collectors.toList());
        });
    }

    @Override
    public PaymentRecord updatePaymentRecord(String planId, int paymentNumber, PaymentRecordUpdate update) {
        return inTransaction("updatePaymentRecord", () -> {
            PaymentRecordEntity entity = paymentRecordRepository.findByPlanIdAndPaymentNumber(planId, paymentNumber)
                    .orElseThrow(() -> new StorageFailureException(
                            "Payment record " + paymentNumber + " of plan " + planId + " does not exist"));

            if (update.getExpectedStatus() != null && entity.getStatus() != update.getExpectedStatus()) {
                throw new ConcurrentPlanUpdateException(String.format(
                        "Payment record %d of plan %s changed concurrently: expected=%s, actual=%s",
                        paymentNumber, planId, update.getExpectedStatus(), entity.getStatus()));
            }

            if (update.getStatus() != null) {
                entity.setStatus(update.getStatus());
            }
            if (update.getTransactionId() != null) {
                entity.setTransactionId(update.getTransactionId());
            }
            if (update.getPaidAt() != null) {
                entity.setPaidAt(update.getPaidAt());
            }
            if (update.getFailedAt() != null) {
                entity.setFailedAt(update.getFailedAt());
            }

            PaymentRecordEntity saved = paymentRecordRepository.saveAndFlush(entity);
            log.debug("Updated payment record: planId={}, paymentNumber={}, status={}",
                    planId, paymentNumber, saved.getStatus());
            return toDomain(saved);
        });
    }

    @Override
    public List<PaymentRecord> listPaymentRecords(String planId) {
        return inTransaction("listPaymentRecords", () ->
                paymentRecordRepository.findByPlanIdOrderByPaymentNumberAsc(planId).stream()
                        .map(JpaPlanStore::toDomain)
                        .collect(Collectors.toList()));
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (StorageFailureException e) {
            throw e;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Optimistic lock conflict in {}: {}", operation, e.getMessage());
            throw new ConcurrentPlanUpdateException("Concurrent modification during " + operation, e);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("Plan store operation {} failed", operation, e);
            throw new StorageFailureException("Plan store operation " + operation + " failed", e);
        }
    }

    static Plan toDomain(PlanEntity entity) {
        return Plan.builder()
                .id(entity.getId())
                .orderReference(entity.getOrderReference())
                .paymentPlan(entity.isPaymentPlan())
                .totalAmount(entity.getTotalAmount())
                .installmentCount(entity.getInstallmentCount())
                .installmentAmount(entity.getInstallmentAmount())
                .subscriptionId(entity.getSubscriptionId())
                .completedPayments(entity.getCompletedPayments())
                .status(entity.getStatus())
                .customerEmail(entity.getCustomerEmail())
                .orderPaymentStatus(entity.getOrderPaymentStatus())
                .orderPaidAt(entity.getOrderPaidAt())
                .orderTransactionId(entity.getOrderTransactionId())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    static PaymentRecord toDomain(PaymentRecordEntity entity) {
        return PaymentRecord.builder()
                .planId(entity.getPlanId())
                .paymentNumber(entity.getPaymentNumber())
                .totalPayments(entity.getTotalPayments())
                .amount(entity.getAmount())
                .status(entity.getStatus())
                .transactionId(entity.getTransactionId())
                .paidAt(entity.getPaidAt())
                .failedAt(entity.getFailedAt())
                .build();
    }
}
