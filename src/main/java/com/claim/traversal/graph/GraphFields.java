package com.claim.traversal.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tolerant field readers for the untyped upstream graph tree.
 * Every reader is total: a value of the wrong shape reads as absent.
 */
final class GraphFields {

    private GraphFields() {
        // utility class
    }

    static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : null;
    }

    static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : null;
    }

    static Object get(Object node, String key) {
        Map<?, ?> map = asMap(node);
        return map != null ? map.get(key) : null;
    }

    static List<?> list(Object node, String key) {
        return asList(get(node, key));
    }

    /**
     * Reads an identifier. Strings and numbers are accepted and trimmed;
     * anything else reads as the empty string.
     */
    static String id(Object value) {
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Number n) {
            return n.toString().trim();
        }
        return "";
    }

    static String id(Object node, String key) {
        return id(get(node, key));
    }

    /**
     * Returns the raw string at {@code key}, or {@code null} when the value is not a string.
     */
    static String string(Object node, String key) {
        return get(node, key) instanceof String s ? s : null;
    }

    /**
     * Returns the first non-blank string among {@code keys}, trimmed, or {@code null}.
     */
    static String firstText(Object node, String... keys) {
        for (String key : keys) {
            String value = string(node, key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Reads a list of identifiers, dropping blanks and non-scalar members.
     * A missing or non-list value reads as an empty list.
     */
    static List<String> idList(Object value) {
        List<?> raw = asList(value);
        if (raw == null) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(raw.size());
        for (Object item : raw) {
            String id = id(item);
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    static List<String> idList(Object node, String key) {
        return idList(get(node, key));
    }

    static boolean isNonBlankString(Object value) {
        return value instanceof String s && !s.isBlank();
    }
}
