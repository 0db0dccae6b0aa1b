package com.payment.plan.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Request body for creating a payment plan. Amount and installment bounds are checked by the
 * calculator so the API and the validate endpoint report the same messages.
 */
@Data
public class CreatePlanRequestDto {

    @NotBlank(message = "orderReference is required")
    private String orderReference;

    @NotNull(message = "totalAmount is required")
    private BigDecimal totalAmount;

    @NotNull(message = "installments is required")
    private Integer installments;

    @Email
    private String customerEmail;
}
