package com.payment.plan.persistence.repository;

import com.payment.plan.persistence.entity.PlanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for installment plans.
 */
@Repository
public interface PlanRepository extends JpaRepository<PlanEntity, String> {

    Optional<PlanEntity> findBySubscriptionId(String subscriptionId);
}
