package com.datamodel.matching.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Open key/value bag of profiling statistics for a single column.
 *
 * <p>Keys follow whatever the profiler emitted ({@code null_pct}, {@code row_count},
 * {@code distinct_count}, ...). A missing key means "unknown", never zero. Lookups
 * never throw: values that are not numbers (or numeric strings) read as absent.</p>
 */
public final class ColumnStatistics {

    private static final ColumnStatistics EMPTY = new ColumnStatistics(Map.of());

    private final Map<String, Object> values;

    private ColumnStatistics(Map<String, Object> values) {
        this.values = values;
    }

    public static ColumnStatistics of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy.isEmpty() ? EMPTY : new ColumnStatistics(Collections.unmodifiableMap(copy));
    }

    public static ColumnStatistics empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns a copy of these statistics with {@code key} set, unless it is already present.
     */
    public ColumnStatistics withDefault(String key, Object value) {
        if (value == null || values.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new ColumnStatistics(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns the numeric value of the first key that is present and parseable.
     * NaN and infinite values are treated as absent.
     */
    public OptionalDouble firstNumber(String... keys) {
        for (String key : keys) {
            OptionalDouble value = number(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns the numeric value stored under {@code key}, if any.
     */
    public OptionalDouble number(String key) {
        Object raw = values.get(key);
        double parsed;
        if (raw instanceof Number n) {
            parsed = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                parsed = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(parsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ColumnStatistics) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnStatistics" + values;
    }
}
