package com.payment.plan.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.plan.domain.WebhookReceipt;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.io.IOException;

/**
 * Stores {@link WebhookReceipt}s as plain JSON with ISO-8601 timestamps. Fields added in later
 * builds are ignored on read so receipts survive a rolling deploy.
 */
public class WebhookReceiptRedisSerializer implements RedisSerializer<WebhookReceipt> {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public WebhookReceiptRedisSerializer() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.writer = mapper.writerFor(WebhookReceipt.class);
        this.reader = mapper.readerFor(WebhookReceipt.class);
    }

    @Override
    public byte[] serialize(WebhookReceipt receipt) throws SerializationException {
        if (receipt == null) {
            return null;
        }
        try {
            return writer.writeValueAsBytes(receipt);
        } catch (IOException e) {
            throw new SerializationException("Could not write receipt for webhook " + receipt.getEventId(), e);
        }
    }

    @Override
    public WebhookReceipt deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return reader.readValue(bytes);
        } catch (IOException e) {
            throw new SerializationException("Could not read webhook receipt (" + bytes.length + " bytes)", e);
        }
    }
}
