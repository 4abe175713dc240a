package org.structdiff.obs;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON encoding for logs and reports: object keys are sorted, unknown values are
 * written as their string form.
 */
public final class JsonEncoder {
    private JsonEncoder() {}

    public static String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String s) {
            appendString(sb, s);
            return;
        }
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Map<?, ?> map) {
            appendObject(sb, map);
            return;
        }
        if (value instanceof Collection<?> collection) {
            appendArray(sb, collection);
            return;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> boxed = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                boxed.add(Array.get(value, i));
            }
            appendArray(sb, boxed);
            return;
        }
        appendString(sb, String.valueOf(value));
    }

    private static void appendObject(StringBuilder sb, Map<?, ?> map) {
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendString(sb, entry.getKey());
            sb.append(':');
            appendValue(sb, entry.getValue());
        }
        sb.append('}');
    }

    private static void appendArray(StringBuilder sb, Collection<?> values) {
        sb.append('[');
        boolean first = true;
        for (Object item : values) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendValue(sb, item);
        }
        sb.append(']');
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
