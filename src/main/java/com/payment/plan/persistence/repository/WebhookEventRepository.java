package com.payment.plan.persistence.repository;

import com.payment.plan.persistence.entity.WebhookEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the webhook delivery archive.
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, String> {
}
