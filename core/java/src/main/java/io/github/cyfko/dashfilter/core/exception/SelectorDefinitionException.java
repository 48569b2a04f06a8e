package io.github.cyfko.dashfilter.core.exception;

/**
 * Exception thrown when a selector or mapping definition is structurally invalid.
 * <p>
 * Raised at definition time, before anything is persisted: an identifier-unsafe selector name,
 * a blank label, a value source attached to a selector type that cannot use one, a target column
 * the chart does not expose, an unknown operator code.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * new Selector(null, 1L, "deal stage", "Stage", SelectorType.DROPDOWN, ...);
 * // → "Selector name 'deal stage' must match [a-zA-Z0-9_]+"
 *
 * Operator.fromString("contains");
 * // → "Unknown operator: 'contains'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see DuplicateDefinitionException
 */
public class SelectorDefinitionException extends RuntimeException {

    /**
     * @param message the description of the invalid definition
     */
    public SelectorDefinitionException(String message) {
        super(message);
    }

    /**
     * @param message the description of the invalid definition
     * @param cause   the underlying cause (e.g. a JSON parsing error on a stored configuration)
     */
    public SelectorDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
