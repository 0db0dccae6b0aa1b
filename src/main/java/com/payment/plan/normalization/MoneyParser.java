package com.payment.plan.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Lenient money parsing for webhook payloads. Currency symbols, thousands separators and
 * whitespace are stripped; negatives clamp to zero; anything unparseable becomes zero.
 */
@Component
public class MoneyParser {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    public BigDecimal parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ZERO;
        }
        if (node.isNumber()) {
            return clamp(node.decimalValue());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return ZERO;
    }

    public BigDecimal parse(Object value) {
        if (value == null) {
            return ZERO;
        }
        if (value instanceof BigDecimal) {
            return clamp((BigDecimal) value);
        }
        if (value instanceof Number) {
            try {
                return clamp(new BigDecimal(value.toString()));
            } catch (NumberFormatException e) {
                return ZERO;
            }
        }
        if (value instanceof JsonNode) {
            return parse((JsonNode) value);
        }
        return parse(value.toString());
    }

    public BigDecimal parse(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        String cleaned = clean(value);
        if (cleaned.isEmpty() || "-".equals(cleaned)) {
            return ZERO;
        }
        try {
            return clamp(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return ZERO;
        }
    }

    /** Keeps digits and dots; a minus sign survives only if it comes before the first digit. */
    private static String clean(String raw) {
        StringBuilder digits = new StringBuilder(raw.length());
        boolean negative = false;
        boolean seenDigit = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
                seenDigit = true;
            } else if (c == '.') {
                digits.append(c);
            } else if (c == '-' && !seenDigit && digits.length() == 0) {
                negative = true;
            }
        }
        return negative ? "-" + digits : digits.toString();
    }

    private static BigDecimal clamp(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return ZERO;
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
