package com.payment.plan.domain;

public enum PaymentRecordStatus {
    PENDING,
    PAID,
    FAILED
}
