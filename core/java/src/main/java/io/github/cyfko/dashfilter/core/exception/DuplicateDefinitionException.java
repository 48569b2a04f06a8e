package io.github.cyfko.dashfilter.core.exception;

/**
 * Exception thrown when a definition collides with an existing one: a selector name already used
 * on the same dashboard, or a mapping identical to an existing {@code (selector, chart, column, table)}.
 * Duplicates are rejected, never merged.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicateDefinitionException extends SelectorDefinitionException {

    public DuplicateDefinitionException(String message) {
        super(message);
    }
}
