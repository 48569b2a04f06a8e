package io.github.cyfko.dashfilter.core.model;

import java.util.Objects;

/**
 * Outcome of composing filters into one chart query, shown side by side in the editor.
 * Never persisted, always recomputed from the chart's original query.
 *
 * @param originalSql the chart query as authored
 * @param filteredSql the query with the predicates inserted
 * @param whereClause the clause text that was inserted ({@code WHERE (...)} or {@code AND (...)}),
 *                    empty when nothing was inserted
 */
public record RewriteResult(String originalSql, String filteredSql, String whereClause) {

    public RewriteResult {
        Objects.requireNonNull(originalSql, "originalSql");
        Objects.requireNonNull(filteredSql, "filteredSql");
        Objects.requireNonNull(whereClause, "whereClause");
    }

    /**
     * Result for a query that received no predicate.
     */
    public static RewriteResult unchanged(String sql) {
        return new RewriteResult(sql, sql, "");
    }

    public boolean isFiltered() {
        return !whereClause.isEmpty();
    }
}
