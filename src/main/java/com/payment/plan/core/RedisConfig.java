package com.payment.plan.core;

import com.payment.plan.domain.WebhookReceipt;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for webhook delivery receipts.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, WebhookReceipt> webhookReceiptRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, WebhookReceipt> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new WebhookReceiptRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
