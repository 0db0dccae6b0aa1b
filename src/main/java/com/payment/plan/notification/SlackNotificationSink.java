package com.payment.plan.notification;

import com.payment.plan.domain.Plan;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts plan milestones to a Slack incoming webhook as a single attachment message.
 */
@Slf4j
@Component
public class SlackNotificationSink implements NotificationSink {

    static final String CIRCUIT_BREAKER = "slack";
    private static final String FOOTER = "Payment Plans";

    private final RestTemplate restTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Value("${payment-plan.notification.slack.enabled:false}")
    private boolean enabled;

    @Value("${payment-plan.notification.slack.webhook-url:}")
    private String webhookUrl;

    @Autowired
    public SlackNotificationSink(CircuitBreakerRegistry circuitBreakerRegistry,
                                 @Value("${payment-plan.notification.slack.timeout-ms:5000}") int timeoutMs) {
        this(buildRestTemplate(timeoutMs), circuitBreakerRegistry);
    }

    SlackNotificationSink(RestTemplate restTemplate, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.restTemplate = restTemplate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        if (enabled && (webhookUrl == null || webhookUrl.isBlank())) {
            log.warn("Slack notifications enabled but payment-plan.notification.slack.webhook-url is not set; skipping");
            return false;
        }
        return enabled;
    }

    @Override
    public void notifyInstallmentPaid(Plan plan, int paymentNumber) {
        boolean completed = plan.isFullyPaid();
        String title = completed
                ? ":tada: Payment plan completed"
                : ":moneybag: Installment " + paymentNumber + "/" + plan.getInstallmentCount() + " received";
        List<Map<String, Object>> fields = baseFields(plan);
        fields.add(field("Payment", paymentNumber + " of " + plan.getInstallmentCount()));
        if (completed) {
            fields.add(field("Total", "$" + plan.getTotalAmount()));
        } else {
            fields.add(field("Amount", "$" + plan.getInstallmentAmount()));
        }
        send(title, completed ? "good" : "#439FE0", fields);
    }

    @Override
    public void notifyPlanSuspended(Plan plan) {
        List<Map<String, Object>> fields = baseFields(plan);
        fields.add(field("Failed payment", (plan.getCompletedPayments() + 1) + " of " + plan.getInstallmentCount()));
        send(":warning: Payment plan suspended", "warning", fields);
    }

    @Override
    public void notifyPlanCancelled(Plan plan) {
        send(":x: Payment plan cancelled", "danger", baseFields(plan));
    }

    private void send(String title, String color, List<Map<String, Object>> fields) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color);
        attachment.put("fields", fields);
        attachment.put("footer", FOOTER);
        attachment.put("ts", Instant.now().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", title);
        payload.put("attachments", List.of(attachment));

        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        try {
            ResponseEntity<String> response = cb.executeSupplier(
                    () -> restTemplate.postForEntity(webhookUrl, payload, String.class));
            log.debug("Slack notification sent: title={}, status={}", title, response.getStatusCode());
        } catch (RestClientException e) {
            throw new NotificationFailureException("Slack webhook call failed: " + e.getMessage(), e);
        }
    }

    private static List<Map<String, Object>> baseFields(Plan plan) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Order", plan.getOrderReference()));
        fields.add(field("Customer", plan.getCustomerEmail()));
        fields.add(field("Progress", plan.getCompletedPayments() + "/" + plan.getInstallmentCount() + " paid"));
        return fields;
    }

    private static Map<String, Object> field(String title, Object value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value == null || value.toString().isBlank() ? "N/A" : value.toString());
        field.put("short", true);
        return field;
    }
}
