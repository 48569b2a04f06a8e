package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.config.PatternConfig;
import io.github.cyfko.dashfilter.core.config.StringEscapeStrategy;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.model.ValueRange;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an operator, a target column and a runtime value into one SQL boolean fragment.
 *
 * <h2>Value shapes</h2>
 * <ul>
 *   <li>{@code equals}, {@code gt}, {@code gte}, {@code lt}, {@code lte}: one scalar</li>
 *   <li>{@code like}: one scalar, rendered as text and wrapped in {@code %...%} after escaping {@code %} and {@code _}</li>
 *   <li>{@code in}: a non-empty collection or array of scalars</li>
 *   <li>{@code between}: a {@link ValueRange}, a map with {@code from} and {@code to} keys, or a two-element list</li>
 * </ul>
 * <p>
 * For temporal selector types (date range, single date) every bound is rendered as {@code 'YYYY-MM-DD'}
 * and values that are not dates are refused. Strings are quoted with embedded quotes doubled,
 * and with backslashes doubled when the builder targets a {@link StringEscapeStrategy#BACKSLASH}
 * database. Numbers and booleans are written bare.
 * </p>
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * builder.build(Operator.EQUALS, "stage", null, "WON").getFragment();
 * // stage = 'WON'
 *
 * builder.build(Operator.IN, "owner_id", "d", List.of(1, 2, 3)).getFragment();
 * // d.owner_id IN (1,2,3)
 *
 * builder.build(Operator.BETWEEN, "created_at", null, 5).getErrorMessage();
 * // Operator between requires a {from, to} pair, got Integer
 * }</pre>
 * <p>
 * Immutable and thread-safe. Value problems are returned as a failed {@link PredicateResult}; only a
 * column or table that is not a plain identifier, which is a definition bug, is thrown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PredicateBuilder {

    private final StringEscapeStrategy escapeStrategy;

    /**
     * Creates a builder for databases that treat backslash as an ordinary character.
     */
    public PredicateBuilder() {
        this(StringEscapeStrategy.STANDARD);
    }

    /**
     * Creates a builder quoting strings for the given backslash handling.
     *
     * @param escapeStrategy how the target database reads backslashes in string literals
     */
    public PredicateBuilder(StringEscapeStrategy escapeStrategy) {
        if (escapeStrategy == null) {
            throw new NullPointerException("Escape strategy cannot be null");
        }
        this.escapeStrategy = escapeStrategy;
    }

    /**
     * Builds the predicate of one active mapping, resolving the mapping's operator override against
     * the selector default.
     *
     * @param selector the mapped selector
     * @param mapping  one mapping of the selector
     * @param value    the selector's active value
     * @return the predicate or the value-shape failure
     */
    public PredicateResult build(Selector selector, SelectorMapping mapping, Object value) {
        return build(selector.effectiveOperator(mapping), selector.type(),
                mapping.targetColumn(), mapping.targetTable(), value);
    }

    /**
     * Builds a predicate without selector-type specific formatting.
     *
     * @see #build(Operator, SelectorType, String, String, Object)
     */
    public PredicateResult build(Operator operator, String column, String table, Object value) {
        return build(operator, null, column, table, value);
    }

    /**
     * Builds a predicate.
     *
     * @param operator the resolved operator
     * @param type     selector type driving date formatting, or {@code null}
     * @param column   target column
     * @param table    table qualifying the column, or {@code null}
     * @param value    runtime value
     * @return the predicate or the value-shape failure
     * @throws NullPointerException        if operator is null
     * @throws SelectorDefinitionException if column or table is not a plain identifier
     */
    public PredicateResult build(Operator operator, SelectorType type, String column, String table, Object value) {
        if (operator == null) {
            throw new NullPointerException("Operator cannot be null");
        }
        String target = qualify(column, table);
        boolean temporal = type != null && type.isTemporal();

        return switch (operator.getArity()) {
            case SINGLE -> operator == Operator.LIKE
                    ? buildLike(target, value)
                    : buildComparison(operator, target, value, temporal);
            case MULTIPLE -> buildIn(target, value, temporal);
            case PAIR -> buildBetween(target, value, temporal);
        };
    }

    private PredicateResult buildComparison(Operator operator, String target, Object value, boolean temporal) {
        if (value == null) {
            return PredicateResult.failure(operator, "Operator " + operator.getCode() + " requires a non-null value");
        }
        Optional<String> literal = literal(value, temporal);
        if (literal.isEmpty()) {
            return PredicateResult.failure(operator, describeScalarFailure(operator, value, temporal));
        }
        return PredicateResult.success(operator, target + " " + operator.getSymbol() + " " + literal.get());
    }

    private PredicateResult buildLike(String target, Object value) {
        if (value == null || !(value instanceof CharSequence || value instanceof Number || value instanceof Character)) {
            return PredicateResult.failure(Operator.LIKE,
                    "Operator like requires a text value, got " + typeName(value));
        }
        String pattern = "%" + SqlLiterals.escapeLike(value.toString()) + "%";
        return PredicateResult.success(Operator.LIKE, target + " LIKE " + SqlLiterals.quote(pattern, escapeStrategy));
    }

    private PredicateResult buildIn(String target, Object value, boolean temporal) {
        List<Object> items = asList(value);
        if (items == null) {
            return PredicateResult.failure(Operator.IN,
                    "Operator in requires a collection of values, got " + typeName(value));
        }
        if (items.isEmpty()) {
            return PredicateResult.failure(Operator.IN, "Operator in requires a non-empty collection");
        }

        List<String> literals = new ArrayList<>(items.size());
        for (Object item : items) {
            Optional<String> literal = item == null ? Optional.empty() : literal(item, temporal);
            if (literal.isEmpty()) {
                return PredicateResult.failure(Operator.IN,
                        "Operator in cannot use element of type " + typeName(item));
            }
            literals.add(literal.get());
        }
        return PredicateResult.success(Operator.IN, target + " IN (" + String.join(",", literals) + ")");
    }

    private PredicateResult buildBetween(String target, Object value, boolean temporal) {
        ValueRange range = asRange(value);
        if (range == null) {
            return PredicateResult.failure(Operator.BETWEEN,
                    "Operator between requires a {from, to} pair, got " + typeName(value));
        }
        if (range.from() == null || range.to() == null) {
            return PredicateResult.failure(Operator.BETWEEN, "Operator between requires both from and to");
        }

        Optional<String> from = literal(range.from(), temporal);
        Optional<String> to = literal(range.to(), temporal);
        if (from.isEmpty() || to.isEmpty()) {
            Object bad = from.isEmpty() ? range.from() : range.to();
            return PredicateResult.failure(Operator.BETWEEN, describeScalarFailure(Operator.BETWEEN, bad, temporal));
        }
        return PredicateResult.success(Operator.BETWEEN, target + " BETWEEN " + from.get() + " AND " + to.get());
    }

    private Optional<String> literal(Object value, boolean temporal) {
        return temporal ? SqlLiterals.date(value) : SqlLiterals.scalar(value, escapeStrategy);
    }

    private static String describeScalarFailure(Operator operator, Object value, boolean temporal) {
        if (temporal && SqlLiterals.isScalar(value)) {
            return "Operator " + operator.getCode() + " requires a date (YYYY-MM-DD), got '" + value + "'";
        }
        return "Operator " + operator.getCode() + " requires a single value, got " + typeName(value);
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return null;
    }

    private static ValueRange asRange(Object value) {
        if (value instanceof ValueRange range) {
            return range;
        }
        if (value instanceof Map<?, ?> map) {
            if (!map.containsKey("from") && !map.containsKey("to")) {
                return null;
            }
            return new ValueRange(map.get("from"), map.get("to"));
        }
        List<Object> items = asList(value);
        if (items != null && items.size() == 2) {
            return new ValueRange(items.get(0), items.get(1));
        }
        return null;
    }

    private static String qualify(String column, String table) {
        if (!PatternConfig.isSqlIdentifier(column)) {
            throw new SelectorDefinitionException("Invalid target column: '" + column + "'");
        }
        if (table == null || table.isBlank()) {
            return column;
        }
        if (!PatternConfig.isSqlIdentifier(table)) {
            throw new SelectorDefinitionException("Invalid target table: '" + table + "'");
        }
        return table + "." + column;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
