package io.github.cyfko.dashfilter.core.api;

import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

import java.util.Optional;

/**
 * Kind of input control a selector renders and the value shape it produces.
 * <p>
 * The type fixes the operator a new selector starts with, whether the selector can carry a
 * {@link io.github.cyfko.dashfilter.core.model.ValueSource} and whether its values are dates,
 * in which case the predicate builder renders them as {@code 'YYYY-MM-DD'} literals.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SelectorType {

    DROPDOWN("dropdown", Operator.EQUALS, true, false),
    MULTI_SELECT("multi_select", Operator.IN, true, false),
    DATE_RANGE("date_range", Operator.BETWEEN, false, true),
    SINGLE_DATE("single_date", Operator.EQUALS, false, true),
    TEXT("text", Operator.LIKE, false, false);

    private final String code;
    private final Operator defaultOperator;
    private final boolean valueSourceAllowed;
    private final boolean temporal;

    SelectorType(String code, Operator defaultOperator, boolean valueSourceAllowed, boolean temporal) {
        this.code = code;
        this.defaultOperator = defaultOperator;
        this.valueSourceAllowed = valueSourceAllowed;
        this.temporal = temporal;
    }

    public String getCode() {
        return code;
    }

    /**
     * Operator used when a selector of this type is created without an explicit one.
     *
     * @return the default operator
     */
    public Operator getDefaultOperator() {
        return defaultOperator;
    }

    /**
     * Only list-like selectors (dropdown, multi-select) offer options from a value source.
     *
     * @return {@code true} if a value source may be attached
     */
    public boolean isValueSourceAllowed() {
        return valueSourceAllowed;
    }

    /**
     * @return {@code true} for date-range and single-date selectors
     */
    public boolean isTemporal() {
        return temporal;
    }

    public static Optional<SelectorType> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (SelectorType type : values()) {
            if (type.code.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a selector type from its code ({@code "multi_select"}) or enum name.
     *
     * @param value the code or name
     * @return the selector type
     * @throws SelectorDefinitionException if the value is not a known type
     */
    public static SelectorType fromString(String value) {
        return lookup(value).orElseThrow(() ->
                new SelectorDefinitionException("Unknown selector type: '" + value + "'"));
    }
}
