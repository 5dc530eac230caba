package com.example.assertdiff.infrastructure;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.AbstractList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns values into the text shown on Expected and But was lines.
 */
public final class ValueFormatter {
    public static final String NULL_TEXT = "null";
    public static final String EMPTY_STRING_TEXT = "<string.Empty>";
    public static final String EMPTY_COLLECTION_TEXT = "<empty>";
    public static final String ELLIPSIS = "...";
    public static final int DEFAULT_COLLECTION_WINDOW = 10;
    public static final String SELF_COLLECTION_TEXT = "(this Collection)";
    public static final String SELF_MAP_TEXT = "(this Map)";

    private ValueFormatter() {
    }

    public static String formatValue(Object value) {
        return formatValue(value, newIdentitySet());
    }

    /**
     * Format at most {@code max} elements of a collection, skipping the first {@code start}.
     * The collection is iterated once and never modified.
     */
    public static String formatCollection(Iterable<?> collection, long start, int max) {
        Set<Object> enclosing = newIdentitySet();
        if (collection != null) {
            enclosing.add(collection);
        }
        return formatCollection(collection, start, max, enclosing);
    }

    /**
     * @param enclosing containers currently being formatted; a container met again inside
     *                  itself is written as a back reference instead of being descended into
     */
    private static String formatValue(Object value, Set<Object> enclosing) {
        if (value == null) {
            return NULL_TEXT;
        }
        if (value instanceof String) {
            return formatEscapedString(escapeControlChars((String) value));
        }
        if (value instanceof Character) {
            return formatChar((Character) value);
        }
        if (value instanceof Double) {
            return formatDouble((Double) value);
        }
        if (value instanceof Float) {
            return formatFloat((Float) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Map.Entry) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) value;
            return "[" + formatValue(entry.getKey(), enclosing) + ", "
                    + formatValue(entry.getValue(), enclosing) + "]";
        }
        if (value instanceof Map) {
            if (enclosing.contains(value)) {
                return SELF_MAP_TEXT;
            }
            return formatContainer(value, ((Map<?, ?>) value).entrySet(), enclosing);
        }
        boolean array = value.getClass().isArray();
        // Path is Iterable over its name elements, but reads better as a path
        if (array || (value instanceof Iterable && !(value instanceof Path))) {
            if (enclosing.contains(value)) {
                return SELF_COLLECTION_TEXT;
            }
            return formatContainer(value, array ? arrayAsList(value) : (Iterable<?>) value, enclosing);
        }
        return String.valueOf(value);
    }

    private static String formatContainer(Object container, Iterable<?> elements, Set<Object> enclosing) {
        enclosing.add(container);
        try {
            return formatCollection(elements, 0, DEFAULT_COLLECTION_WINDOW, enclosing);
        } finally {
            enclosing.remove(container);
        }
    }

    private static String formatCollection(Iterable<?> collection, long start, int max, Set<Object> enclosing) {
        if (collection == null) {
            return NULL_TEXT;
        }
        int count = 0;
        long index = 0;
        StringBuilder sb = new StringBuilder();
        Iterator<?> iterator = collection.iterator();
        while (count < max && iterator.hasNext()) {
            Object element = iterator.next();
            if (index++ < start) {
                continue;
            }
            sb.append(++count == 1 ? "< " : ", ");
            sb.append(formatValue(element, enclosing));
        }
        if (count == 0) {
            return EMPTY_COLLECTION_TEXT;
        }
        // more elements remain; hasNext() does not consume them
        if (iterator.hasNext()) {
            sb.append(ELLIPSIS);
        }
        sb.append(" >");
        return sb.toString();
    }

    /**
     * Quote a string whose control characters were already escaped.
     */
    public static String formatEscapedString(String escaped) {
        if (escaped.isEmpty()) {
            return EMPTY_STRING_TEXT;
        }
        return "\"" + escaped + "\"";
    }

    public static String escapeControlChars(String s) {
        if (s == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            appendEscaped(sb, s.charAt(i));
        }
        return sb.toString();
    }

    public static String escapeNullCharacters(String s) {
        if (s == null || s.indexOf('\0') < 0) {
            return s;
        }
        return s.replace("\0", "\\0");
    }

    private static void appendEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '"' -> sb.append("\\\"");
            case '\0' -> sb.append("\\0");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            default -> {
                if (Character.isISOControl(c) || c == '\u0085' || c == '\u2028' || c == '\u2029') {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
    }

    private static String formatChar(char c) {
        String escaped = c == '\'' ? "\\'" : c == '"' ? "\"" : escapeControlChars(String.valueOf(c));
        return "'" + escaped + "'";
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        return Double.toString(d) + "d";
    }

    private static String formatFloat(float f) {
        if (Float.isNaN(f) || Float.isInfinite(f)) {
            return Float.toString(f);
        }
        return Float.toString(f) + "f";
    }

    private static Set<Object> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static List<Object> arrayAsList(Object array) {
        int length = Array.getLength(array);
        return new AbstractList<>() {
            @Override
            public Object get(int index) {
                return Array.get(array, index);
            }

            @Override
            public int size() {
                return length;
            }
        };
    }
}
