package com.payment.plan.core;

import com.payment.plan.domain.WebhookReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which gateway envelopes have already been applied. This is a fast path only: when
 * Redis is unavailable lookups miss and writes are dropped, and the state machine's own
 * transaction-id checks keep redeliveries harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIdempotencyService {

    static final String KEY_PREFIX = "payment-plan:webhook:";

    private final RedisTemplate<String, WebhookReceipt> redisTemplate;

    @Value("${payment-plan.idempotency.ttl-hours:72}")
    private long ttlHours = 72;

    public Optional<WebhookReceipt> findReceipt(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return Optional.empty();
        }
        String key = KEY_PREFIX + eventId;
        try {
            WebhookReceipt receipt = redisTemplate.opsForValue().get(key);
            if (receipt != null) {
                log.debug("Webhook receipt hit for eventId={}", eventId);
                return Optional.of(receipt);
            }
        } catch (Exception e) {
            if (e.getClass().getSimpleName().contains("Serialization")) {
                log.error("Webhook receipt for eventId={} exists but cannot be read; processing the delivery again", eventId, e);
            } else {
                log.warn("Webhook receipt lookup failed for eventId={} (Redis unavailable): {}", eventId, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public void storeReceipt(WebhookReceipt receipt) {
        if (receipt == null || receipt.getEventId() == null || receipt.getEventId().isBlank()) {
            return;
        }
        String key = KEY_PREFIX + receipt.getEventId();
        try {
            redisTemplate.opsForValue().set(key, receipt, Duration.ofHours(ttlHours));
            log.debug("Stored webhook receipt for eventId={}, outcome={}", receipt.getEventId(), receipt.getOutcome());
        } catch (Exception e) {
            log.warn("Failed to store webhook receipt for eventId={}: {}", receipt.getEventId(), e.getMessage());
        }
    }
}
