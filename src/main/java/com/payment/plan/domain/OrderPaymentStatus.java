package com.payment.plan.domain;

/**
 * Payment state of the order/quote that owns a plan.
 */
public enum OrderPaymentStatus {
    UNPAID,
    PAID
}
