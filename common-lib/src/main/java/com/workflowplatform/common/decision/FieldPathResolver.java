package com.workflowplatform.common.decision;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * Resolves dot/bracket paths such as {@code signal.targets[0].price} or {@code matrix[1][2]}
 * against nested {@link Map}, {@link List}, array and Jackson {@link JsonNode} values.
 *
 * <p>Missing keys, out-of-range indexes and indexing into a non-container all resolve to
 * {@code null}. JSON leaves are returned as plain Java values.
 */
public final class FieldPathResolver {

    private FieldPathResolver() {}

    public static Object resolve(Object data, String path) {
        if (path == null || path.isBlank()) {
            return unwrap(data);
        }
        Object current = data;
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return null;
            }
            int bracket = segment.indexOf('[');
            String key = bracket < 0 ? segment : segment.substring(0, bracket);
            if (!key.isEmpty()) {
                current = child(current, key);
            }
            while (bracket >= 0 && current != null) {
                int close = segment.indexOf(']', bracket);
                if (close < 0) {
                    return null;
                }
                int index;
                try {
                    index = Integer.parseInt(segment.substring(bracket + 1, close).trim());
                } catch (NumberFormatException e) {
                    return null;
                }
                current = element(current, index);
                bracket = segment.indexOf('[', close);
            }
        }
        return unwrap(current);
    }

    private static Object child(Object container, String key) {
        if (container instanceof Map<?, ?> map) {
            return map.get(key);
        }
        if (container instanceof JsonNode node) {
            return node.isObject() ? node.get(key) : null;
        }
        return null;
    }

    private static Object element(Object container, int index) {
        if (index < 0) {
            return null;
        }
        if (container instanceof List<?> list) {
            return index < list.size() ? list.get(index) : null;
        }
        if (container instanceof JsonNode node) {
            return node.isArray() ? node.get(index) : null;
        }
        if (container.getClass().isArray()) {
            return index < Array.getLength(container) ? Array.get(container, index) : null;
        }
        return null;
    }

    private static Object unwrap(Object value) {
        if (!(value instanceof JsonNode node)) {
            return value;
        }
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node;
    }
}
