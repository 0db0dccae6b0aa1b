package com.payment.plan.core;

import com.payment.plan.api.InvalidPlanParametersException;
import com.payment.plan.domain.InstallmentSchedule;
import com.payment.plan.domain.PlanValidationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits a plan total into installments. The recurring amount is the total divided by the count,
 * rounded down to the cent; the first payment carries the remainder.
 */
@Component
public class InstallmentCalculator {

    public static final int MIN_INSTALLMENTS = 2;
    public static final int MAX_INSTALLMENTS = 12;
    public static final BigDecimal MIN_PAYMENT = new BigDecimal("1.00");

    private static final int CENTS = 2;
    private static final String WHOLE_CENTS_MESSAGE = "Total amount must be in whole cents";

    public InstallmentSchedule computeSchedule(BigDecimal totalAmount, Integer installments) {
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new InvalidPlanParametersException("Total amount must be greater than 0");
        }
        if (hasSubCentDigits(totalAmount)) {
            throw new InvalidPlanParametersException(WHOLE_CENTS_MESSAGE);
        }
        if (installments == null || installments < MIN_INSTALLMENTS || installments > MAX_INSTALLMENTS) {
            throw new InvalidPlanParametersException(
                    "Installments must be between " + MIN_INSTALLMENTS + " and " + MAX_INSTALLMENTS);
        }

        BigDecimal total = totalAmount.setScale(CENTS, RoundingMode.HALF_UP);
        BigDecimal count = BigDecimal.valueOf(installments);

        BigDecimal base = total.divide(count, CENTS, RoundingMode.FLOOR);
        BigDecimal remainder = total.subtract(base.multiply(count)).setScale(CENTS, RoundingMode.HALF_UP);
        BigDecimal firstPayment = base.add(remainder).setScale(CENTS, RoundingMode.HALF_UP);

        return InstallmentSchedule.builder()
                .totalAmount(total)
                .installments(installments)
                .firstPayment(firstPayment)
                .recurringAmount(base)
                .remainingOccurrences(installments - 1)
                .build();
    }

    /**
     * Form-level validation: same limits as {@link #computeSchedule} plus a minimum of $1.00 per
     * payment. Reports the first problem found instead of throwing.
     */
    public PlanValidationResult validate(BigDecimal totalAmount, Integer installments) {
        if (totalAmount == null) {
            return PlanValidationResult.invalid("Invalid total amount");
        }
        if (totalAmount.compareTo(MIN_PAYMENT) < 0) {
            return PlanValidationResult.invalid("Total amount must be at least $1");
        }
        if (hasSubCentDigits(totalAmount)) {
            return PlanValidationResult.invalid(WHOLE_CENTS_MESSAGE);
        }
        if (installments == null) {
            return PlanValidationResult.invalid("Invalid number of installments");
        }
        if (installments < MIN_INSTALLMENTS || installments > MAX_INSTALLMENTS) {
            return PlanValidationResult.invalid(
                    "Installments must be between " + MIN_INSTALLMENTS + " and " + MAX_INSTALLMENTS);
        }

        InstallmentSchedule schedule = computeSchedule(totalAmount, installments);
        if (schedule.getRecurringAmount().compareTo(MIN_PAYMENT) < 0) {
            return PlanValidationResult.invalid("Minimum payment would be $" + schedule.getRecurringAmount()
                    + ". Each payment must be at least $1.00");
        }
        return PlanValidationResult.ok();
    }

    private static boolean hasSubCentDigits(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() > CENTS;
    }
}
