package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;
import io.github.cyfko.dashfilter.core.model.RewriteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryRewriter")
class QueryRewriterTest {

    private final QueryRewriter rewriter = new QueryRewriter();

    private String filtered(String query, String... predicates) {
        return rewriter.rewrite(query, List.of(predicates)).filteredSql();
    }

    @Nested
    @DisplayName("Insertion point")
    class InsertionTests {

        @Test
        @DisplayName("should insert WHERE before GROUP BY")
        void shouldInsertWhereBeforeGroupBy() {
            RewriteResult result = rewriter.rewrite(
                    "SELECT stage, COUNT(*) c FROM deals GROUP BY stage ORDER BY c DESC",
                    List.of("stage = 'WON'"));

            assertEquals("SELECT stage, COUNT(*) c FROM deals WHERE (stage = 'WON') GROUP BY stage ORDER BY c DESC",
                    result.filteredSql());
            assertEquals("WHERE (stage = 'WON')", result.whereClause());
            assertEquals("SELECT stage, COUNT(*) c FROM deals GROUP BY stage ORDER BY c DESC", result.originalSql());
            assertTrue(result.isFiltered());
        }

        @Test
        @DisplayName("should append AND to an existing WHERE")
        void shouldAppendToExistingWhere() {
            RewriteResult result = rewriter.rewrite(
                    "SELECT owner_id, SUM(amount) FROM deals WHERE created_at > '2023-01-01' GROUP BY owner_id",
                    List.of("owner_id IN (1,2,3)"));

            assertEquals("SELECT owner_id, SUM(amount) FROM deals WHERE created_at > '2023-01-01' "
                    + "AND (owner_id IN (1,2,3)) GROUP BY owner_id", result.filteredSql());
            assertEquals("AND (owner_id IN (1,2,3))", result.whereClause());
        }

        @Test
        @DisplayName("should append WHERE at the end when there is no tail")
        void shouldAppendAtEnd() {
            assertEquals("SELECT * FROM deals WHERE (stage = 'WON')", filtered("SELECT * FROM deals", "stage = 'WON'"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ORDER BY id", "LIMIT 10", "OFFSET 5", "HAVING COUNT(*) > 1", "FETCH FIRST 5 ROWS ONLY",
                "FOR SHARE", "FOR UPDATE SKIP LOCKED"})
        @DisplayName("should stop at every tail keyword")
        void shouldStopAtTailKeyword(String tail) {
            assertEquals("SELECT * FROM deals WHERE (a = 1) " + tail, filtered("SELECT * FROM deals " + tail, "a = 1"));
        }

        @Test
        @DisplayName("should keep a locking clause after the filter")
        void shouldStopAtLockingClause() {
            assertEquals("SELECT * FROM deals WHERE a = 1 AND (b = 2) ORDER BY id FOR UPDATE",
                    filtered("SELECT * FROM deals WHERE a = 1 ORDER BY id FOR UPDATE", "b = 2"));
            assertEquals("SELECT SUBSTRING(name FROM 1 FOR 3) FROM deals WHERE (b = 2)",
                    filtered("SELECT SUBSTRING(name FROM 1 FOR 3) FROM deals", "b = 2"));
        }

        @Test
        @DisplayName("should combine predicates with AND in order")
        void shouldCombineInOrder() {
            RewriteResult result = rewriter.rewrite("SELECT * FROM deals LIMIT 100", List.of("a = 1", "b IN (2,3)"));

            assertEquals("SELECT * FROM deals WHERE (a = 1) AND (b IN (2,3)) LIMIT 100", result.filteredSql());
            assertEquals("WHERE (a = 1) AND (b IN (2,3))", result.whereClause());
        }

        @Test
        @DisplayName("should match keywords regardless of case and line breaks")
        void shouldMatchKeywordsCaseInsensitively() {
            assertEquals("select *\nfrom deals\nwhere x = 1 AND (a = 1)\ngroup   by x",
                    filtered("select *\nfrom deals\nwhere x = 1\ngroup   by x", "a = 1"));
        }
    }

    @Nested
    @DisplayName("Depth safety")
    class DepthTests {

        @Test
        @DisplayName("should ignore WHERE and GROUP BY inside a derived table")
        void shouldIgnoreSubquery() {
            assertEquals("SELECT * FROM (SELECT x FROM t WHERE y > 1 GROUP BY x) s WHERE (s.x = 5)",
                    filtered("SELECT * FROM (SELECT x FROM t WHERE y > 1 GROUP BY x) s", "s.x = 5"));
        }

        @Test
        @DisplayName("should ignore keywords inside CTE bodies and window specs")
        void shouldIgnoreCteAndWindow() {
            String query = "WITH won AS (SELECT * FROM deals WHERE stage = 'WON' ORDER BY id) "
                    + "SELECT owner_id, ROW_NUMBER() OVER (PARTITION BY owner_id ORDER BY amount) rn FROM won ORDER BY rn";

            assertEquals("WITH won AS (SELECT * FROM deals WHERE stage = 'WON' ORDER BY id) "
                    + "SELECT owner_id, ROW_NUMBER() OVER (PARTITION BY owner_id ORDER BY amount) rn FROM won "
                    + "WHERE (owner_id = 7) ORDER BY rn", filtered(query, "owner_id = 7"));
        }

        @Test
        @DisplayName("should ignore keywords inside literals, quoted names and comments")
        void shouldIgnoreLiteralsAndComments() {
            String query = "SELECT 'GROUP BY' AS label, \"order\" FROM deals /* WHERE x */ -- LIMIT 5\n";

            assertEquals("SELECT 'GROUP BY' AS label, \"order\" FROM deals WHERE (a = 1) /* WHERE x */ -- LIMIT 5\n",
                    filtered(query, "a = 1"));
        }

        @Test
        @DisplayName("should not treat a qualified column named like a keyword as a boundary")
        void shouldIgnoreQualifiedKeywordNames() {
            assertEquals("SELECT * FROM t WHERE t.limit > 1 AND (a = 1)", filtered("SELECT * FROM t WHERE t.limit > 1", "a = 1"));
        }
    }

    @Nested
    @DisplayName("Statement terminator and OR precedence")
    class TerminatorTests {

        @Test
        @DisplayName("should keep the trailing semicolon after the insertion")
        void shouldKeepSemicolon() {
            assertEquals("SELECT * FROM deals WHERE (a = 1);", filtered("SELECT * FROM deals;", "a = 1"));
            assertEquals("SELECT * FROM deals WHERE (a = 1) ORDER BY id ;\n",
                    filtered("SELECT * FROM deals ORDER BY id ;\n", "a = 1"));
        }

        @Test
        @DisplayName("should parenthesise an existing condition holding a top-level OR")
        void shouldParenthesiseOr() {
            assertEquals("SELECT * FROM deals WHERE (a = 1 OR b = 2) AND (c = 3) ORDER BY id",
                    filtered("SELECT * FROM deals WHERE a = 1 OR b = 2 ORDER BY id", "c = 3"));
        }

        @Test
        @DisplayName("should leave a nested OR alone")
        void shouldLeaveNestedOr() {
            assertEquals("SELECT * FROM deals WHERE (a = 1 OR b = 2) AND (c = 3)",
                    filtered("SELECT * FROM deals WHERE (a = 1 OR b = 2)", "c = 3"));
        }
    }

    @Nested
    @DisplayName("No predicates")
    class IdempotenceTests {

        @Test
        @DisplayName("rewriting with no predicates returns the query unchanged")
        void noPredicatesIsNoOp() {
            String query = "SELECT * FROM (SELECT 1";
            RewriteResult once = rewriter.rewrite(query, List.of());
            RewriteResult twice = rewriter.rewrite(once.filteredSql(), List.of());

            assertEquals(query, twice.filteredSql());
            assertEquals("", twice.whereClause());
            assertFalse(twice.isFiltered());
        }

        @Test
        @DisplayName("rewriting is deterministic")
        void rewritingIsDeterministic() {
            String query = "SELECT * FROM deals WHERE x = 1 GROUP BY y";
            assertEquals(rewriter.rewrite(query, List.of("a = 1")), rewriter.rewrite(query, List.of("a = 1")));
        }
    }

    @Nested
    @DisplayName("Malformed queries")
    class MalformedTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "SELECT * FROM (SELECT 1",
                "SELECT * FROM t WHERE a = 'open",
                "SELECT * FROM t) x",
                "SELECT * FROM t /* no end",
                "   ",
                "UPDATE t SET a = 1",
                "SELECT a FROM t UNION SELECT a FROM u",
                "SELECT * FROM t; DELETE FROM t",
                "SELECT 1",
                "SELECT * FROM t GROUP BY a WHERE b = 1",
                "SELECT * FROM t FOR UPDATE WHERE b = 1"
        })
        @DisplayName("should refuse to guess")
        void shouldRefuse(String query) {
            assertThrows(MalformedQueryException.class, () -> rewriter.rewrite(query, List.of("a = 1")));
        }

        @Test
        @DisplayName("should report the position of the problem")
        void shouldReportPosition() {
            MalformedQueryException e = assertThrows(MalformedQueryException.class,
                    () -> rewriter.rewrite("SELECT a FROM t UNION SELECT a FROM u", List.of("a = 1")));

            assertEquals(16, e.getPosition());
            assertTrue(e.getMessage().contains("UNION"));
        }

        @Test
        @DisplayName("should reject blank predicates")
        void shouldRejectBlankPredicate() {
            assertThrows(IllegalArgumentException.class, () -> rewriter.rewrite("SELECT * FROM t", List.of(" ")));
        }
    }
}
