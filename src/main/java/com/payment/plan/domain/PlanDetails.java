package com.payment.plan.domain;

import lombok.Value;

import java.util.List;

/**
 * A plan together with its installments ordered by payment number.
 */
@Value
public class PlanDetails {

    Plan plan;
    List<PaymentRecord> payments;
}
