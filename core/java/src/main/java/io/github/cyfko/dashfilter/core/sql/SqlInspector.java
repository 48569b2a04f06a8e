package io.github.cyfko.dashfilter.core.sql;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Light read-only inspection of chart queries.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SqlInspector {

    private static final Set<String> NOT_ALIASES = Set.of(
            "ON", "USING", "WHERE", "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "NATURAL",
            "GROUP", "ORDER", "HAVING", "WINDOW", "LIMIT", "OFFSET", "FETCH", "UNION", "INTERSECT", "EXCEPT",
            "LATERAL", "TABLESAMPLE", "FOR");

    private SqlInspector() {
    }

    /**
     * Lists the tables named right after {@code FROM} or {@code JOIN}, at any depth, in order of first
     * appearance and without duplicates. Derived tables ({@code FROM (SELECT ...)}) and quoted names are
     * not reported; a schema-qualified name reports the table part.
     *
     * @param sql query text
     * @return referenced table names as written
     * @throws io.github.cyfko.dashfilter.core.exception.MalformedQueryException if the query cannot be scanned
     */
    public static List<String> referencedTables(String sql) {
        return scanTables(sql, false);
    }

    /**
     * Lists the aliases given to the tables reported by {@link #referencedTables(String)}
     * ({@code FROM crm_deals d}, {@code JOIN users AS u}).
     *
     * @param sql query text
     * @return aliases as written, in order of first appearance
     */
    public static List<String> tableAliases(String sql) {
        return scanTables(sql, true);
    }

    private static List<String> scanTables(String sql, boolean aliases) {
        SqlScanner.Layout layout = SqlScanner.scan(sql);
        List<SqlScanner.Word> words = layout.words();
        Set<String> tables = new LinkedHashSet<>();

        for (int k = 0; k + 1 < words.size(); k++) {
            SqlScanner.Word word = words.get(k);
            if (!(word.isKeyword("FROM") || word.isKeyword("JOIN"))) {
                continue;
            }
            SqlScanner.Word next = words.get(k + 1);
            if (!sql.substring(word.end(), next.start()).isBlank()) {
                continue;
            }
            int last = k + 1;
            while (last + 1 < words.size() && words.get(last + 1).qualified()
                    && sql.substring(words.get(last).end(), words.get(last + 1).start()).trim().equals(".")) {
                last++;
            }
            if (!aliases) {
                tables.add(text(sql, words.get(last)));
                continue;
            }
            int alias = last + 1;
            if (alias < words.size() && adjacent(sql, words.get(last), words.get(alias))
                    && words.get(alias).isKeyword("AS")) {
                alias++;
            }
            if (alias < words.size() && adjacent(sql, words.get(alias - 1), words.get(alias))
                    && !words.get(alias).qualified() && !NOT_ALIASES.contains(words.get(alias).text())) {
                tables.add(text(sql, words.get(alias)));
            }
        }
        return new ArrayList<>(tables);
    }

    private static boolean adjacent(String sql, SqlScanner.Word first, SqlScanner.Word second) {
        return first.depth() == second.depth() && sql.substring(first.end(), second.start()).isBlank();
    }

    private static String text(String sql, SqlScanner.Word word) {
        return sql.substring(word.start(), word.end());
    }
}
