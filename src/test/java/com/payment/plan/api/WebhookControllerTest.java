package com.payment.plan.api;

import com.payment.plan.core.WebhookProcessingService;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.PlanStatus;
import com.payment.plan.domain.SkipReason;
import com.payment.plan.domain.TransitionOutcome;
import com.payment.plan.domain.WebhookReceipt;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    private static final String PAYMENT_EVENT = """
            {
              "id": "evt-7",
              "eventType": "net.authorize.payment.authcapture.created",
              "payload": {"id": "tx-2", "authAmount": 100.00, "subscription": {"id": "SUB-42"}}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookProcessingService processingService;

    @Test
    void appliedEventIsAcknowledged() throws Exception {
        when(processingService.process(any(), anyString())).thenReturn(WebhookReceipt.builder()
                .eventId("evt-7")
                .kind(EventKind.INSTALLMENT_PAID)
                .outcome(TransitionOutcome.APPLIED)
                .planId("plan-1")
                .paymentNumber(2)
                .planStatus(PlanStatus.ACTIVE)
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/webhooks/gateway")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYMENT_EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.eventId").value("evt-7"))
                .andExpect(jsonPath("$.outcome").value("APPLIED"))
                .andExpect(jsonPath("$.paymentNumber").value(2))
                .andExpect(jsonPath("$.planStatus").value("ACTIVE"));

        verify(processingService).process(argThat(node -> "evt-7".equals(node.path("id").asText())), eq(PAYMENT_EVENT));
    }

    @Test
    void skippedEventStillReturnsOk() throws Exception {
        when(processingService.process(any(), anyString())).thenReturn(WebhookReceipt.builder()
                .eventId("evt-8")
                .kind(EventKind.PLAN_CANCELLED)
                .outcome(TransitionOutcome.SKIPPED)
                .skipReason(SkipReason.PLAN_NOT_FOUND)
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/webhooks/gateway")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "evt-8", "eventType": "net.authorize.customer.subscription.cancelled",
                                 "payload": {"id": "SUB-unknown"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SKIPPED"))
                .andExpect(jsonPath("$.skipReason").value("PLAN_NOT_FOUND"));
    }

    @Test
    void malformedBodyIsHandedOnAsMissingEnvelope() throws Exception {
        when(processingService.process(any(), anyString())).thenReturn(WebhookReceipt.builder()
                .kind(EventKind.UNSUPPORTED)
                .outcome(TransitionOutcome.SKIPPED)
                .skipReason(SkipReason.UNSUPPORTED_EVENT)
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/webhooks/gateway")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skipReason").value("UNSUPPORTED_EVENT"));

        verify(processingService).process(argThat(node -> node.isMissingNode()), eq("{not json"));
    }

    @Test
    void emptyBodyIsAccepted() throws Exception {
        when(processingService.process(any(), isNull())).thenReturn(WebhookReceipt.builder()
                .kind(EventKind.UNSUPPORTED)
                .outcome(TransitionOutcome.SKIPPED)
                .skipReason(SkipReason.UNSUPPORTED_EVENT)
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/webhooks/gateway").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SKIPPED"));
    }

    @Test
    void storageFailureAsksGatewayToRedeliver() throws Exception {
        when(processingService.process(any(), anyString()))
                .thenThrow(new StorageFailureException("Plan storage unavailable"));

        mockMvc.perform(post("/api/v1/webhooks/gateway")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYMENT_EVENT))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("STORAGE_UNAVAILABLE"));
    }
}
