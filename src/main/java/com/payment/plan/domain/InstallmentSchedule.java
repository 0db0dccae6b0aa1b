package com.payment.plan.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Rounded split of a plan total. The first payment absorbs the cent remainder so that
 * {@code firstPayment + recurringAmount * remainingOccurrences == totalAmount}.
 */
@Value
@Builder
public class InstallmentSchedule {

    BigDecimal totalAmount;
    int installments;
    /** Charged immediately, out of band. */
    BigDecimal firstPayment;
    BigDecimal recurringAmount;
    /** Occurrences the gateway subscription charges after the first payment. */
    int remainingOccurrences;

    public BigDecimal amountFor(int paymentNumber) {
        return paymentNumber == 1 ? firstPayment : recurringAmount;
    }
}
