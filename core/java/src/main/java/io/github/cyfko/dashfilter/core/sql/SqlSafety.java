package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.exception.UnsafeQueryException;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Guards applied to a chart query right before it is executed.
 * <p>
 * Keywords are matched on whole words outside literals and comments, so {@code WHERE note = 'DROP'}
 * passes while {@code SELECT 1; DROP TABLE t} does not.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SqlSafety {

    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "TRUNCATE",
            "CREATE", "GRANT", "REVOKE", "EXEC", "EXECUTE");

    private SqlSafety() {
    }

    /**
     * Ensures the query is a single read-only statement.
     *
     * @param sql query text
     * @throws UnsafeQueryException if the query is empty, not a SELECT/WITH, holds a second statement
     *                              or a data-modifying keyword
     * @throws io.github.cyfko.dashfilter.core.exception.MalformedQueryException if the query cannot be scanned
     */
    public static void requireReadOnly(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new UnsafeQueryException("Query is empty");
        }
        SqlScanner.Layout layout = SqlScanner.scan(sql);
        List<SqlScanner.Word> top = layout.topLevel();

        if (top.isEmpty() || !(top.get(0).isKeyword("SELECT") || top.get(0).isKeyword("WITH"))) {
            throw new UnsafeQueryException("Only SELECT queries are allowed");
        }
        if (layout.extraStatement()) {
            throw new UnsafeQueryException("Multiple SQL statements are not allowed");
        }
        for (SqlScanner.Word word : layout.words()) {
            if (!word.qualified() && FORBIDDEN_KEYWORDS.contains(word.text())) {
                throw new UnsafeQueryException("Forbidden SQL keyword: " + word.text());
            }
        }
    }

    /**
     * Ensures every table the query reads from belongs to the allowed set (case-insensitive).
     *
     * @param sql           query text
     * @param allowedTables tables the query may reference
     * @throws UnsafeQueryException naming the first table outside the set
     */
    public static void requireAllowedTables(String sql, Collection<String> allowedTables) {
        Set<String> allowed = allowedTables.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (String table : SqlInspector.referencedTables(sql)) {
            if (!allowed.contains(table.toLowerCase(Locale.ROOT))) {
                throw new UnsafeQueryException("Table '" + table + "' is not in the allowed list: "
                        + String.join(", ", allowedTables));
            }
        }
    }

    /**
     * Caps the row count of a query.
     * <ul>
     *   <li>A depth-0 {@code LIMIT n} or {@code FETCH FIRST|NEXT n ROWS ONLY} larger than {@code maxRows}
     *       is lowered to {@code maxRows}.</li>
     *   <li>A query with a plain {@code OFFSET m} gets {@code LIMIT maxRows} inserted before the offset.</li>
     *   <li>A query with a standard {@code OFFSET m ROWS} gets {@code FETCH FIRST maxRows ROWS ONLY}
     *       after the offset.</li>
     *   <li>Otherwise {@code LIMIT maxRows} is added after the last significant token, before any
     *       depth-0 locking clause ({@code FOR UPDATE}, {@code FOR SHARE}).</li>
     * </ul>
     * <p>
     * A row count that is not a plain number (a bind parameter, {@code ALL}) is left untouched; the
     * driver-side row cap still applies.
     * </p>
     *
     * @param sql     query text
     * @param maxRows the row cap, positive
     * @return the capped query
     */
    public static String ensureLimit(String sql, int maxRows) {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, got: " + maxRows);
        }
        SqlScanner.Layout layout = SqlScanner.scan(sql);
        List<SqlScanner.Word> top = layout.topLevel();

        SqlScanner.Word limit = null;
        int offset = -1;
        int fetch = -1;
        int locking = -1;
        for (int i = 0; i < top.size(); i++) {
            String text = top.get(i).text();
            if (text.equals("LIMIT")) {
                limit = top.get(i);
            } else if (text.equals("OFFSET") && offset < 0) {
                offset = i;
            } else if (text.equals("FETCH") && fetch < 0) {
                fetch = i;
            } else if (text.equals("FOR") && locking < 0 && i > 0) {
                locking = i;
            }
        }

        if (limit != null) {
            return capNumberAfter(sql, limit.end(), maxRows);
        }
        if (fetch >= 0) {
            boolean counted = fetch + 1 < top.size()
                    && (top.get(fetch + 1).text().equals("FIRST") || top.get(fetch + 1).text().equals("NEXT"));
            return counted ? capNumberAfter(sql, top.get(fetch + 1).end(), maxRows) : sql;
        }
        if (offset >= 0) {
            SqlScanner.Word offsetWord = top.get(offset);
            boolean standard = offset + 1 < top.size()
                    && (top.get(offset + 1).text().equals("ROWS") || top.get(offset + 1).text().equals("ROW"));
            if (!standard) {
                return sql.substring(0, offsetWord.start()) + "LIMIT " + maxRows + " " + sql.substring(offsetWord.start());
            }
            int end = insertionEnd(layout, top, locking);
            return sql.substring(0, end) + " FETCH FIRST " + maxRows + " ROWS ONLY" + sql.substring(end);
        }

        int end = insertionEnd(layout, top, locking);
        return sql.substring(0, end) + " LIMIT " + maxRows + sql.substring(end);
    }

    private static int insertionEnd(SqlScanner.Layout layout, List<SqlScanner.Word> top, int locking) {
        return locking >= 0 ? top.get(locking).previousEnd() : layout.contentEnd();
    }

    /**
     * Lowers the number following {@code position} (after optional whitespace) when it exceeds the cap.
     */
    private static String capNumberAfter(String sql, int position, int maxRows) {
        int start = position;
        while (start < sql.length() && Character.isWhitespace(sql.charAt(start))) {
            start++;
        }
        int end = start;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
            end++;
        }
        if (end == start) {
            return sql;
        }
        String digits = sql.substring(start, end);
        boolean exceeds = digits.length() > 9 || Integer.parseInt(digits) > maxRows;
        return exceeds ? sql.substring(0, start) + maxRows + sql.substring(end) : sql;
    }
}
