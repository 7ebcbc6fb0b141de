package com.racing.reconcile.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One loosely-typed record contributed by a single source, for example one driver as seen
 * by one telemetry feed. Field names vary by source; see {@link FieldAliases}.
 *
 * <p>Typed accessors are lenient: a value of the wrong shape reads as {@code null}
 * instead of failing.</p>
 */
public final class RawRecord {

    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord of(Map<String, ?> fields) {
        return new RawRecord(fields != null ? new LinkedHashMap<>(fields) : Map.of());
    }

    public static RawRecord of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keyValues.length + " arguments");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new RawRecord(fields);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return isPresent(fields.get(field));
    }

    /**
     * Returns the field as trimmed text, or {@code null} when absent or blank.
     * Nested mappings and collections are not text and read as {@code null}.
     */
    public String getString(String field) {
        Object value = fields.get(field);
        if (value == null || value instanceof Map || value instanceof Iterable) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Returns the field as an integer. Whole numeric strings such as {@code "33"} are accepted;
     * fractional numbers are truncated. Values outside the {@code int} range give {@code null}.
     */
    public Integer getInteger(String field) {
        Object value = fields.get(field);
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? toInteger(BigDecimal.valueOf(number)) : null;
        }
        String text = value instanceof Number ? value.toString() : getString(field);
        if (text == null) {
            return null;
        }
        try {
            return toInteger(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer toInteger(BigDecimal number) {
        BigDecimal whole = number.setScale(0, RoundingMode.DOWN);
        if (whole.compareTo(INT_MIN) < 0 || whole.compareTo(INT_MAX) > 0) {
            return null;
        }
        return whole.intValue();
    }

    public Double getDouble(String field) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = getString(field);
        if (text == null) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String field) {
        Object value = fields.get(field);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * A value counts as present when it is non-null and, for text, not blank.
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawRecord that = (RawRecord) o;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
