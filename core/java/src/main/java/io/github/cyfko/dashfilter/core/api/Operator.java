package io.github.cyfko.dashfilter.core.api;

import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

import java.util.Optional;

/**
 * Catalog of the comparison operators a selector can apply to a chart column.
 * <p>
 * The catalog is fixed: operators are not stored entities, only their {@linkplain #getCode() code}
 * is persisted with selectors and mappings. Each operator declares the {@link ValueArity} of the
 * value it accepts, which the predicate builder enforces before any SQL is produced.
 * </p>
 *
 * <table>
 *   <caption>Operators</caption>
 *   <tr><th>operator</th><th>arity</th><th>predicate</th></tr>
 *   <tr><td>equals</td><td>SINGLE</td><td>{@code col = value}</td></tr>
 *   <tr><td>in</td><td>MULTIPLE</td><td>{@code col IN (v1,v2)}</td></tr>
 *   <tr><td>between</td><td>PAIR</td><td>{@code col BETWEEN from AND to}</td></tr>
 *   <tr><td>like</td><td>SINGLE</td><td>{@code col LIKE '%value%'}</td></tr>
 *   <tr><td>gt / gte / lt / lte</td><td>SINGLE</td><td>{@code col > value}, ...</td></tr>
 * </table>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Operator op = Operator.fromString("between");
 * if (op.getArity() == ValueArity.PAIR) {
 *     // expects {from, to}
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {

    /** Equality: "=" */
    EQUALS("equals", "=", ValueArity.SINGLE),

    /** Set membership: "IN" */
    IN("in", "IN", ValueArity.MULTIPLE),

    /** Inclusive range: "BETWEEN" */
    BETWEEN("between", "BETWEEN", ValueArity.PAIR),

    /** Substring match: "LIKE" */
    LIKE("like", "LIKE", ValueArity.SINGLE),

    /** Greater than: "&gt;" */
    GT("gt", ">", ValueArity.SINGLE),

    /** Greater than or equal: "&gt;=" */
    GTE("gte", ">=", ValueArity.SINGLE),

    /** Less than: "&lt;" */
    LT("lt", "<", ValueArity.SINGLE),

    /** Less than or equal: "&lt;=" */
    LTE("lte", "<=", ValueArity.SINGLE);

    private final String code;
    private final String symbol;
    private final ValueArity arity;

    Operator(String code, String symbol, ValueArity arity) {
        this.code = code;
        this.symbol = symbol;
        this.arity = arity;
    }

    /**
     * Returns the persisted code of the operator, e.g. {@code "equals"} or {@code "gte"}.
     *
     * @return the lower-case operator code
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the SQL symbol of the operator, e.g. {@code "="} or {@code "BETWEEN"}.
     *
     * @return the SQL symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the shape of value this operator accepts.
     *
     * @return the value arity
     */
    public ValueArity getArity() {
        return arity;
    }

    /**
     * Finds an operator by code, symbol or enum name, ignoring case and surrounding whitespace.
     *
     * @param value code, symbol or name, may be {@code null}
     * @return the matching operator, or empty when nothing matches
     */
    public static Optional<Operator> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Operator op : values()) {
            if (op.code.equalsIgnoreCase(trimmed)
                    || op.symbol.equalsIgnoreCase(trimmed)
                    || op.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds an operator by code, symbol or enum name, ignoring case.
     *
     * @param value code, symbol or name
     * @return the matching operator, never {@code null}
     * @throws SelectorDefinitionException if no operator matches
     */
    public static Operator fromString(String value) {
        return lookup(value).orElseThrow(() ->
                new SelectorDefinitionException("Unknown operator: '" + value + "'"));
    }
}
