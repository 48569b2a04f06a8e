package io.github.cyfko.dashfilter.core.model;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filter values a viewer has set on a dashboard, keyed by selector name.
 * <p>
 * The value shape follows the selector type: a scalar for dropdown and single-date selectors, a
 * collection for multi-select, a {@link ValueRange} (or a {@code {from, to}} map, or a two-element list)
 * for date ranges, free text for text selectors. Values are ephemeral and never stored by the engine.
 * </p>
 *
 * <h2>Inactive values</h2>
 * <p>
 * A value is <em>inactive</em>, and excluded from composition, when it is {@code null}, an empty string,
 * an empty collection or array, or a map whose entries are all inactive (an untouched date range).
 * </p>
 *
 * <pre>{@code
 * FilterValues values = FilterValues.builder()
 *     .value("status", "WON")
 *     .value("owner", List.of(1, 2, 3))
 *     .value("period", ValueRange.of("2024-01-01", "2024-02-01"))
 *     .build();
 * }</pre>
 *
 * @param values immutable map of selector name to value, in insertion order; {@code null} values allowed
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterValues(Map<String, Object> values) {

    public FilterValues {
        Objects.requireNonNull(values, "values cannot be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FilterValues empty() {
        return new FilterValues(Map.of());
    }

    public static FilterValues of(Map<String, ?> values) {
        return new FilterValues(new LinkedHashMap<>(values));
    }

    /**
     * @param selectorName selector name
     * @return the raw value, or {@code null} if absent
     */
    public Object get(String selectorName) {
        return values.get(selectorName);
    }

    /**
     * @param selectorName selector name
     * @return {@code true} if a value is present and active
     */
    public boolean isActive(String selectorName) {
        return !isInactive(values.get(selectorName));
    }

    /**
     * Applies the inactive-value rule to a raw value.
     *
     * @param value any filter value
     * @return {@code true} if the value must be ignored by composition
     */
    public static boolean isInactive(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().allMatch(FilterValues::isInactive);
        }
        if (value instanceof ValueRange range) {
            return isInactive(range.from()) && isInactive(range.to());
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder value(String selectorName, Object value) {
            values.put(Objects.requireNonNull(selectorName, "selectorName"), value);
            return this;
        }

        public FilterValues build() {
            return new FilterValues(values);
        }
    }
}
