package com.payment.plan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Payment Plan Engine. Provides:
 * <ul>
 *   <li>Installment schedules with exact cent rounding</li>
 *   <li>Gateway webhook ingestion with tolerant payload normalization</li>
 *   <li>Idempotent plan/installment state transitions (per-subscription locking, optimistic CAS)</li>
 *   <li>Post-commit notifications to Slack, CRM and Kafka</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class PaymentPlanEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentPlanEngineApplication.class, args);
    }
}
