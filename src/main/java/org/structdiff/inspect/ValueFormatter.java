package org.structdiff.inspect;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders inspected values in Java-literal style for diff output.
 */
public final class ValueFormatter {
    private ValueFormatter() {}

    public static String render(InspectedValue value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    /**
     * Name of a type descriptor: {@code java.lang} and {@code java.util} types by simple name,
     * arrays by component name plus {@code []}, everything else by canonical name.
     */
    public static String typeName(Class<?> type) {
        if (type.isArray()) {
            return typeName(type.getComponentType()) + "[]";
        }
        if (type.isPrimitive()) {
            return type.getName();
        }
        String packageName = type.getPackageName();
        if ("java.lang".equals(packageName) || "java.util".equals(packageName)) {
            return type.getSimpleName();
        }
        String canonical = type.getCanonicalName();
        return canonical == null ? type.getName() : canonical;
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(sb, value.charAt(i), '"');
        }
        sb.append('"');
        return sb.toString();
    }

    public static String quote(char value) {
        StringBuilder sb = new StringBuilder(3);
        sb.append('\'');
        appendEscaped(sb, value, '\'');
        sb.append('\'');
        return sb.toString();
    }

    private static void append(StringBuilder sb, InspectedValue value, Set<Object> inProgress) {
        if (!value.isPresent()) {
            sb.append("null");
            return;
        }
        switch (value.kind()) {
            case BOOLEAN, INTEGER, FLOAT, COMPLEX, VALUE -> sb.append(value.raw());
            case UNSIGNED -> sb.append(quote(value.unsignedValue()));
            case STRING -> sb.append(quote(value.stringValue()));
            case ENUM -> sb.append(simpleName(value.type())).append('.').append(((Enum<?>) value.raw()).name());
            case FUNCTION, HANDLE -> sb.append(simpleName(value.type()))
                .append("@0x")
                .append(Integer.toHexString(value.address()));
            case VARIANT -> append(sb, value.elem(), inProgress);
            case OPTIONAL -> {
                if (value.isNil()) {
                    sb.append("Optional.empty");
                } else {
                    sb.append("Optional[");
                    append(sb, value.elem(), inProgress);
                    sb.append(']');
                }
            }
            case ARRAY, SEQUENCE, SET, MAP, RECORD -> appendComposite(sb, value, inProgress);
            default -> throw new UnsupportedKindException(value.typeName(), "unknown value kind " + value.kind());
        }
    }

    private static void appendComposite(StringBuilder sb, InspectedValue value, Set<Object> inProgress) {
        if (!inProgress.add(value.raw())) {
            sb.append(simpleName(value.type())).append("{...}");
            return;
        }
        try {
            switch (value.kind()) {
                case ARRAY -> {
                    sb.append(typeName(value.type())).append('{');
                    appendElements(sb, value, inProgress);
                    sb.append('}');
                }
                case SEQUENCE -> {
                    sb.append('[');
                    appendElements(sb, value, inProgress);
                    sb.append(']');
                }
                case SET -> {
                    sb.append("Set[");
                    appendAll(sb, value.setElements(), inProgress);
                    sb.append(']');
                }
                case MAP -> {
                    sb.append('{');
                    boolean first = true;
                    for (InspectedValue key : value.mapKeys()) {
                        if (!first) {
                            sb.append(", ");
                        }
                        first = false;
                        append(sb, key, inProgress);
                        sb.append(": ");
                        append(sb, value.mapIndex(key), inProgress);
                    }
                    sb.append('}');
                }
                default -> {
                    sb.append(simpleName(value.type())).append('{');
                    for (int i = 0; i < value.fieldCount(); i++) {
                        if (i > 0) {
                            sb.append(", ");
                        }
                        sb.append(value.fieldName(i)).append(": ");
                        append(sb, value.field(i), inProgress);
                    }
                    sb.append('}');
                }
            }
        } finally {
            inProgress.remove(value.raw());
        }
    }

    private static void appendElements(StringBuilder sb, InspectedValue value, Set<Object> inProgress) {
        int length = value.length();
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            append(sb, value.index(i), inProgress);
        }
    }

    private static void appendAll(StringBuilder sb, List<InspectedValue> values, Set<Object> inProgress) {
        boolean first = true;
        for (InspectedValue item : values) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            append(sb, item, inProgress);
        }
    }

    private static String simpleName(Class<?> type) {
        String simple = type.getSimpleName();
        return simple.isEmpty() ? typeName(type) : simple;
    }

    private static void appendEscaped(StringBuilder sb, char c, char delimiter) {
        if (c == delimiter) {
            sb.append('\\').append(c);
            return;
        }
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            default -> {
                if (c <= 0x1F || c == 0x7F) {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
    }
}
