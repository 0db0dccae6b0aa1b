package com.payment.plan.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Gateway identifiers from the immediate first charge and the subscription created for the rest.
 */
@Data
public class FirstPaymentRequestDto {

    @NotBlank(message = "transactionId is required")
    private String transactionId;

    @NotBlank(message = "subscriptionId is required")
    private String subscriptionId;
}
