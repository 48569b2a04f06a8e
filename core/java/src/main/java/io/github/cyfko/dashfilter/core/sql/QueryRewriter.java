package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;
import io.github.cyfko.dashfilter.core.model.RewriteResult;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Inserts predicate fragments into a chart query at the outer statement's filter position.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Scan the query once, tracking parenthesis depth and skipping literals and comments
 *       (see {@link SqlScanner}). Only depth-0 keywords are considered, so subqueries, CTE bodies
 *       and window specifications never capture the insertion.</li>
 *   <li>Locate the outer {@code FROM}, the first {@code WHERE} after it and the tail boundary:
 *       the earliest of {@code GROUP BY}, {@code HAVING}, {@code WINDOW}, {@code ORDER BY},
 *       {@code LIMIT}, {@code OFFSET}, {@code FETCH} and a locking {@code FOR} clause
 *       ({@code FOR UPDATE}, {@code FOR SHARE}).</li>
 *   <li>Combine the predicates as {@code (p1) AND (p2) AND ...}.</li>
 *   <li>Insert {@code AND (...)} when a {@code WHERE} exists, {@code WHERE (...)} otherwise, right
 *       after the last significant token before the tail boundary (or the end of the statement).</li>
 * </ol>
 * <p>
 * A trailing {@code ;} and trailing comments stay where they are. When the existing condition holds a
 * depth-0 {@code OR} it is parenthesised first, otherwise {@code a OR b AND (p)} would bind the new
 * predicate to {@code b} only.
 * </p>
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * rewriter.rewrite("SELECT stage, COUNT(*) c FROM deals GROUP BY stage", List.of("stage = 'WON'"));
 * // SELECT stage, COUNT(*) c FROM deals WHERE (stage = 'WON') GROUP BY stage
 *
 * rewriter.rewrite("SELECT * FROM deals WHERE a = 1 OR b = 2", List.of("c = 3"));
 * // SELECT * FROM deals WHERE (a = 1 OR b = 2) AND (c = 3)
 * }</pre>
 * <p>
 * Callers always rewrite the original chart query; feeding a rewritten query back in adds the
 * predicates a second time. The rewriter is stateless and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QueryRewriter {

    private static final Logger logger = Logger.getLogger(QueryRewriter.class.getName());

    private static final Set<String> TAIL_KEYWORDS = Set.of("HAVING", "WINDOW", "LIMIT", "OFFSET", "FETCH", "FOR");
    private static final Set<String> SET_OPERATORS = Set.of("UNION", "INTERSECT", "EXCEPT");

    /**
     * Rewrites a query with the given predicates.
     *
     * @param query      original query
     * @param predicates predicate fragments, combined with {@code AND} in the given order
     * @return original and filtered query with the inserted clause; the query itself when there is no predicate
     * @throws MalformedQueryException when no safe insertion point can be found
     */
    public RewriteResult rewrite(String query, List<String> predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return RewriteResult.unchanged(query);
        }
        if (query == null || query.isBlank()) {
            throw new MalformedQueryException("Query is empty");
        }
        for (String predicate : predicates) {
            if (predicate == null || predicate.isBlank()) {
                throw new IllegalArgumentException("Predicate fragments cannot be blank");
            }
        }

        SqlScanner.Layout layout = SqlScanner.scan(query);
        Boundaries boundaries = locate(layout);

        String combined = predicates.stream()
                .map(p -> "(" + p.trim() + ")")
                .collect(Collectors.joining(" AND "));

        int insertAt = boundaries.tail != null ? boundaries.tail.previousEnd() : layout.contentEnd();
        String head = query.substring(0, insertAt);
        String clause;

        if (boundaries.where == null) {
            clause = "WHERE " + combined;
        } else {
            clause = "AND " + combined;
            if (boundaries.hasTopLevelOr) {
                head = parenthesizeCondition(query, boundaries.where.end(), insertAt);
            }
        }

        String filtered = head + " " + clause + query.substring(insertAt);
        logger.fine(() -> "Inserted " + predicates.size() + " predicate(s) at offset " + insertAt + ": " + clause);
        return new RewriteResult(query, filtered, clause);
    }

    private static Boundaries locate(SqlScanner.Layout layout) {
        List<SqlScanner.Word> top = layout.topLevel();

        if (top.isEmpty() || !(top.get(0).isKeyword("SELECT") || top.get(0).isKeyword("WITH"))) {
            throw new MalformedQueryException("Only SELECT or WITH queries can be filtered", 0);
        }
        if (layout.extraStatement()) {
            throw new MalformedQueryException("Query contains more than one statement", layout.terminator());
        }

        int from = -1;
        SqlScanner.Word where = null;
        SqlScanner.Word tail = null;
        boolean hasTopLevelOr = false;

        for (int k = 0; k < top.size(); k++) {
            SqlScanner.Word word = top.get(k);
            String text = word.text();

            if (SET_OPERATORS.contains(text)) {
                throw new MalformedQueryException("Top-level " + text + " at position " + word.start() + " is not supported", word.start());
            }
            if (from < 0) {
                if (text.equals("FROM")) {
                    from = k;
                }
                continue;
            }
            if (text.equals("WHERE")) {
                if (tail != null) {
                    throw new MalformedQueryException("WHERE found after " + tail.text(), word.start());
                }
                if (where == null) {
                    where = word;
                }
                continue;
            }
            if (tail == null && isTailKeyword(top, k)) {
                tail = word;
                continue;
            }
            if (where != null && tail == null && text.equals("OR")) {
                hasTopLevelOr = true;
            }
        }

        if (from < 0) {
            throw new MalformedQueryException("Query has no top-level FROM clause");
        }
        return new Boundaries(where, tail, hasTopLevelOr);
    }

    private static boolean isTailKeyword(List<SqlScanner.Word> top, int k) {
        String text = top.get(k).text();
        if (TAIL_KEYWORDS.contains(text)) {
            return true;
        }
        if (text.equals("GROUP") || text.equals("ORDER")) {
            return k + 1 < top.size() && top.get(k + 1).text().equals("BY");
        }
        return false;
    }

    private static String parenthesizeCondition(String query, int conditionStart, int conditionEnd) {
        int start = conditionStart;
        while (start < conditionEnd && Character.isWhitespace(query.charAt(start))) {
            start++;
        }
        return query.substring(0, start) + "(" + query.substring(start, conditionEnd) + ")";
    }

    private record Boundaries(SqlScanner.Word where, SqlScanner.Word tail, boolean hasTopLevelOr) {
    }
}
