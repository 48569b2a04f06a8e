package io.github.cyfko.dashfilter.core.model;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by executing one chart query.
 *
 * @param rows          result rows, column label to value, in column order
 * @param rowCount      number of rows
 * @param elapsedMillis execution time
 */
public record QueryResult(List<Map<String, Object>> rows, int rowCount, long elapsedMillis) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult of(List<Map<String, Object>> rows, long elapsedMillis) {
        return new QueryResult(rows, rows.size(), elapsedMillis);
    }
}
