package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One scheduled installment of a plan. Numbers are contiguous from 1 to the plan's installment count.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRecord {

    String planId;
    int paymentNumber;
    int totalPayments;
    BigDecimal amount;
    PaymentRecordStatus status;
    String transactionId;
    Instant paidAt;
    Instant failedAt;

    public boolean isPaid() {
        return status == PaymentRecordStatus.PAID;
    }
}
