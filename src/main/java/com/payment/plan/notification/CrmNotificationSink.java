package com.payment.plan.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.plan.domain.Plan;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records plan milestones on the customer's CRM contact: one note per event plus a tag that CRM
 * automations key off ({@code payment-plan-paid-N}, {@code payment-plan-completed},
 * {@code payment-plan-suspended}, {@code payment-plan-cancelled}).
 */
@Slf4j
@Component
public class CrmNotificationSink implements NotificationSink {

    static final String CIRCUIT_BREAKER = "crm";

    private final RestTemplate restTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Value("${payment-plan.notification.crm.enabled:false}")
    private boolean enabled;

    @Value("${payment-plan.notification.crm.base-url:https://rest.gohighlevel.com/v1}")
    private String baseUrl;

    @Value("${payment-plan.notification.crm.api-key:}")
    private String apiKey;

    @Autowired
    public CrmNotificationSink(CircuitBreakerRegistry circuitBreakerRegistry,
                               @Value("${payment-plan.notification.crm.timeout-ms:5000}") int timeoutMs) {
        this(buildRestTemplate(timeoutMs), circuitBreakerRegistry);
    }

    CrmNotificationSink(RestTemplate restTemplate, CircuitBreakerRegistry circuitBreakerRegistry) {
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
        return "crm";
    }

    @Override
    public boolean isEnabled() {
        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("CRM notifications enabled but payment-plan.notification.crm.api-key is not set; skipping");
            return false;
        }
        return enabled;
    }

    @Override
    public void notifyInstallmentPaid(Plan plan, int paymentNumber) {
        if (plan.isFullyPaid()) {
            record(plan,
                    String.format("Payment plan completed for order %s: all %d payments received (total $%s).",
                            plan.getOrderReference(), plan.getInstallmentCount(), plan.getTotalAmount()),
                    List.of("payment-plan-paid-" + paymentNumber, "payment-plan-completed"));
        } else {
            record(plan,
                    String.format("Payment plan installment %d of %d received for order %s ($%s).",
                            paymentNumber, plan.getInstallmentCount(), plan.getOrderReference(), plan.getInstallmentAmount()),
                    List.of("payment-plan-paid-" + paymentNumber));
        }
    }

    @Override
    public void notifyPlanSuspended(Plan plan) {
        record(plan,
                String.format("Payment plan for order %s suspended after payment %d of %d failed.",
                        plan.getOrderReference(), plan.getCompletedPayments() + 1, plan.getInstallmentCount()),
                List.of("payment-plan-suspended"));
    }

    @Override
    public void notifyPlanCancelled(Plan plan) {
        record(plan,
                String.format("Payment plan for order %s cancelled with %d of %d payments received.",
                        plan.getOrderReference(), plan.getCompletedPayments(), plan.getInstallmentCount()),
                List.of("payment-plan-cancelled"));
    }

    private void record(Plan plan, String note, List<String> tags) {
        String email = plan.getCustomerEmail();
        if (email == null || email.isBlank()) {
            log.info("No customer email on planId={}; CRM update skipped", plan.getId());
            return;
        }
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        try {
            cb.executeRunnable(() -> {
                Optional<String> contactId = findContactId(email);
                if (contactId.isEmpty()) {
                    log.info("No CRM contact for email={}; planId={} not recorded", email, plan.getId());
                    return;
                }
                post("/contacts/" + contactId.get() + "/notes/", Map.of("body", note));
                post("/contacts/" + contactId.get() + "/tags/", Map.of("tags", tags));
                log.debug("CRM updated: contactId={}, planId={}, tags={}", contactId.get(), plan.getId(), tags);
            });
        } catch (RestClientException e) {
            throw new NotificationFailureException("CRM call failed for planId=" + plan.getId() + ": " + e.getMessage(), e);
        }
    }

    private Optional<String> findContactId(String email) {
        String url = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/contacts/search")
                .queryParam("email", email.toLowerCase())
                .toUriString();
        JsonNode response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class).getBody();
        if (response == null || !response.path("contacts").isArray()) {
            return Optional.empty();
        }
        for (JsonNode contact : response.path("contacts")) {
            if (email.equalsIgnoreCase(contact.path("email").asText(""))) {
                return Optional.ofNullable(contact.path("id").asText(null));
            }
        }
        return Optional.empty();
    }

    private void post(String path, Map<String, Object> body) {
        String url = UriComponentsBuilder.fromUriString(baseUrl).path(path).toUriString();
        restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers()), String.class);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
