package com.payment.plan.persistence.repository;

import com.payment.plan.persistence.entity.PaymentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for plan installments.
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecordEntity, String> {

    List<PaymentRecordEntity> findByPlanIdOrderByPaymentNumberAsc(String planId);

    Optional<PaymentRecordEntity> findByPlanIdAndPaymentNumber(String planId, int paymentNumber);
}
