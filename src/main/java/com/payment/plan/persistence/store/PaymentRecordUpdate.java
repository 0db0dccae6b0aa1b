package com.payment.plan.persistence.store;

import com.payment.plan.domain.PaymentRecordStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial installment update. Null fields are left untouched.
 */
@Value
@Builder
public class PaymentRecordUpdate {

    PaymentRecordStatus status;
    /** Compare-and-swap guard on the stored status. */
    PaymentRecordStatus expectedStatus;
    String transactionId;
    Instant paidAt;
    Instant failedAt;
}
