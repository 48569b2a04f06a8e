package io.github.cyfko.dashfilter.core.exception;

/**
 * Exception thrown when the query rewriter cannot find a safe insertion point in a chart query.
 * <p>
 * The rewriter does not guess. Unbalanced parentheses or quotes, an empty query, a second statement,
 * a top-level set operation ({@code UNION}, {@code INTERSECT}, {@code EXCEPT}) or a statement that is
 * not a {@code SELECT} all end here. Editors surface it as "cannot preview this query".
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * rewriter.rewrite("SELECT * FROM (SELECT 1", predicates);
 * // → "Unbalanced parentheses: 1 unclosed '(' at end of query"
 *
 * rewriter.rewrite("SELECT a FROM t UNION SELECT a FROM u", predicates);
 * // → "Top-level UNION at position 16 is not supported"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MalformedQueryException extends RuntimeException {

    private final int position;

    /**
     * @param message the description of the problem
     */
    public MalformedQueryException(String message) {
        this(message, -1);
    }

    /**
     * @param message  the description of the problem
     * @param position the character offset where the problem was detected, or -1
     */
    public MalformedQueryException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return the character offset where the problem was detected, or -1 when not applicable
     */
    public int getPosition() {
        return position;
    }
}
