package io.github.cyfko.dashfilter.core.exception;

import io.github.cyfko.dashfilter.core.api.Operator;

/**
 * Exception thrown when a filter value does not have the shape its resolved operator requires.
 * <p>
 * The predicate builder reports these problems as a failed
 * {@link io.github.cyfko.dashfilter.core.sql.PredicateResult}; this exception is what callers get
 * when they decide the failure cannot be recovered locally, typically the filter composer.
 * The problem is always fixable by correcting the caller's value.
 * </p>
 *
 * <p><strong>Typical messages:</strong></p>
 * <pre>{@code
 * // between with a scalar
 * "Operator between requires a {from, to} pair, got Integer"
 *
 * // in with an empty array
 * "Operator in requires a non-empty collection"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Operator#getArity()
 */
public class InvalidValueShapeException extends RuntimeException {

    private final Operator operator;

    /**
     * @param operator the operator the value was checked against, may be {@code null}
     * @param message  the description of the mismatch
     */
    public InvalidValueShapeException(Operator operator, String message) {
        super(message);
        this.operator = operator;
    }

    /**
     * @return the operator the value was checked against, or {@code null} if unknown
     */
    public Operator getOperator() {
        return operator;
    }
}
