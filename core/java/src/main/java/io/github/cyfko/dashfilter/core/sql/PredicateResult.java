package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.exception.InvalidValueShapeException;

/**
 * Result of building one predicate: either the SQL fragment or the reason the value was refused.
 * <p>
 * A value of the wrong shape is a data problem, not an exceptional condition, so the builder returns
 * it instead of throwing. Callers that cannot recover convert it with {@link #orElseThrow()}.
 * </p>
 *
 * <pre>{@code
 * PredicateResult result = builder.build(Operator.BETWEEN, "created_at", null, 5);
 * if (!result.isSuccess()) {
 *     log.warning(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PredicateResult {

    private final String fragment;
    private final Operator operator;
    private final String errorMessage;

    private PredicateResult(String fragment, Operator operator, String errorMessage) {
        this.fragment = fragment;
        this.operator = operator;
        this.errorMessage = errorMessage;
    }

    public static PredicateResult success(Operator operator, String fragment) {
        return new PredicateResult(fragment, operator, null);
    }

    public static PredicateResult failure(Operator operator, String errorMessage) {
        return new PredicateResult(null, operator, errorMessage);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    /**
     * @return the SQL fragment, or {@code null} on failure
     */
    public String getFragment() {
        return fragment;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * @return the failure reason, or {@code null} on success
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return the fragment
     * @throws InvalidValueShapeException if the build failed
     */
    public String orElseThrow() {
        if (!isSuccess()) {
            throw new InvalidValueShapeException(operator, errorMessage);
        }
        return fragment;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PredicateResult[" + fragment + "]"
                : "PredicateResult[error=" + errorMessage + "]";
    }
}
