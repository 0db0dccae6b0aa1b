package com.payment.plan.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.payment.plan.core.WebhookProcessingService;
import com.payment.plan.domain.WebhookReceipt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment gateway webhooks.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Gateway event notifications for installment plans")
public class WebhookController {

    private final WebhookProcessingService processingService;
    private final ObjectMapper objectMapper;

    @PostMapping("/gateway")
    @Operation(
            summary = "Receive gateway webhook",
            description = "Accepts any gateway event envelope. Payment, suspension and cancellation events update the "
                    + "linked installment plan; all other events are acknowledged and ignored. "
                    + "Redeliveries of an already applied event do not change the plan.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event received. body.outcome is APPLIED or SKIPPED (with skipReason).",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = WebhookResponseDto.class))),
            @ApiResponse(responseCode = "503", description = "Plan storage unavailable or contended. The gateway should redeliver. Body: { \"error\": \"STORAGE_UNAVAILABLE\", \"message\": \"...\" }")
    })
    public ResponseEntity<WebhookResponseDto> receive(@RequestBody(required = false) String body) {
        JsonNode envelope = parse(body);
        WebhookReceipt receipt = processingService.process(envelope, body);
        return ResponseEntity.ok(WebhookResponseDto.from(receipt));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            log.warn("Webhook received with empty body");
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Webhook body is not valid JSON ({} chars): {}", body.length(), e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }
}
