package com.payment.plan.api;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class ValidatePlanRequestDto {

    private BigDecimal totalAmount;
    private Integer installments;
}
