package com.payment.plan.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates dotted field paths ("payload.subscription.id") against a JSON tree and returns the
 * first candidate that is present and non-empty. Never throws.
 */
@Component
public class FieldPathResolver {

    public Optional<JsonNode> firstPresent(JsonNode root, List<String> paths) {
        if (root == null || paths == null) {
            return Optional.empty();
        }
        for (String path : paths) {
            JsonNode node = resolve(root, path);
            if (isPresent(node)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /** First present scalar rendered as trimmed text; objects and arrays are skipped. */
    public Optional<String> firstText(JsonNode root, List<String> paths) {
        if (root == null || paths == null) {
            return Optional.empty();
        }
        for (String path : paths) {
            JsonNode node = resolve(root, path);
            if (isPresent(node) && node.isValueNode()) {
                return Optional.of(node.asText().trim());
            }
        }
        return Optional.empty();
    }

    JsonNode resolve(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    private static boolean isPresent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }
}
