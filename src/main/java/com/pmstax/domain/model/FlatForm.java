package com.pmstax.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Editable, flat view of one component: one entry per leaf field, in schema order.
 *
 * <p>Values are {@link BigDecimal}, {@link String} or {@link Boolean}. Null values are
 * rejected; an empty field holds zero, the empty string or false.
 */
public final class FlatForm {

    private final LinkedHashMap<String, Object> values;

    public FlatForm() {
        this.values = new LinkedHashMap<>();
    }

    private FlatForm(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public static FlatForm copyOf(FlatForm other) {
        return new FlatForm(other.values);
    }

    public static FlatForm of(Map<String, Object> values) {
        FlatForm form = new FlatForm();
        values.forEach(form::put);
        return form;
    }

    public FlatForm put(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, () -> "null value for field " + field);
        if (!(value instanceof BigDecimal) && !(value instanceof String) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException(
                    "Unsupported value type " + value.getClass().getSimpleName() + " for field " + field);
        }
        values.put(field, value);
        return this;
    }

    public Object get(String field) {
        return values.get(field);
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public BigDecimal getNumber(String field) {
        Object value = values.get(field);
        return value instanceof BigDecimal number ? number : BigDecimal.ZERO;
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value == null ? "" : value.toString();
    }

    public boolean getBoolean(String field) {
        return Boolean.TRUE.equals(values.get(field));
    }

    /** Numeric fields only, for aggregate-limit sums. */
    public Map<String, BigDecimal> numericValues() {
        Map<String, BigDecimal> numbers = new LinkedHashMap<>();
        values.forEach((field, value) -> {
            if (value instanceof BigDecimal number) {
                numbers.put(field, number);
            }
        });
        return numbers;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    /** Numeric values compare by value, so 100 and 100.00 are equal. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlatForm other) || !values.keySet().equals(other.values.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object mine = entry.getValue();
            Object theirs = other.values.get(entry.getKey());
            if (mine instanceof BigDecimal a && theirs instanceof BigDecimal b) {
                if (a.compareTo(b) != 0) {
                    return false;
                }
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            int valueHash = value instanceof BigDecimal number ? number.stripTrailingZeros().hashCode() : value.hashCode();
            hash += entry.getKey().hashCode() ^ valueHash;
        }
        return hash;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
