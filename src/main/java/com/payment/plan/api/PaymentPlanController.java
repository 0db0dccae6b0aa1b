package com.payment.plan.api;

import com.payment.plan.core.PaymentPlanService;
import com.payment.plan.domain.PlanDetails;
import com.payment.plan.domain.PlanValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for creating installment plans and reading their progress.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payment-plans")
@RequiredArgsConstructor
@Tag(name = "Payment plans", description = "Create installment plans and query their progress")
public class PaymentPlanController {

    private final PaymentPlanService paymentPlanService;

    @PostMapping
    @Operation(summary = "Create payment plan",
            description = "Splits the order total into 2 to 12 installments. The first installment absorbs the cent remainder.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan created in PENDING with one payment record per installment.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PlanResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid total or installment count. Body: { \"error\": \"INVALID_PLAN_PARAMETERS\"|\"VALIDATION_FAILED\", ... }")
    })
    public ResponseEntity<PlanResponseDto> create(@Valid @RequestBody CreatePlanRequestDto dto) {
        PlanDetails created = paymentPlanService.createPlan(
                dto.getOrderReference(), dto.getTotalAmount(), dto.getInstallments(), dto.getCustomerEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(PlanResponseDto.from(created));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate plan parameters",
            description = "Checks a total and installment count before checkout. Always 200; body.valid tells the result.")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody ValidatePlanRequestDto dto) {
        PlanValidationResult result = paymentPlanService.validate(dto.getTotalAmount(), dto.getInstallments());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", result.isValid());
        body.put("error", result.getError());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{planId}")
    @Operation(summary = "Get plan status", description = "Plan progress with its payment records ordered by number.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PlanResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "No plan with this id.")
    })
    public ResponseEntity<PlanResponseDto> get(@PathVariable String planId) {
        return ResponseEntity.ok(PlanResponseDto.from(paymentPlanService.getPlanStatus(planId)));
    }

    @PostMapping("/{planId}/first-payment")
    @Operation(summary = "Record first payment",
            description = "Marks installment 1 paid and links the gateway subscription that bills the remaining installments. "
                    + "Repeating the call with the same transaction returns the current plan unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan is ACTIVE with one payment completed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PlanResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "No plan with this id."),
            @ApiResponse(responseCode = "409", description = "Plan is not pending or its first payment was recorded with another transaction.")
    })
    public ResponseEntity<PlanResponseDto> firstPayment(@PathVariable String planId,
                                                        @Valid @RequestBody FirstPaymentRequestDto dto) {
        PlanDetails details = paymentPlanService.markFirstPaymentComplete(planId, dto.getTransactionId(), dto.getSubscriptionId());
        return ResponseEntity.ok(PlanResponseDto.from(details));
    }
}
