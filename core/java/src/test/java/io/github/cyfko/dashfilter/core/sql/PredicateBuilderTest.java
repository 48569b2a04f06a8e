package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.config.StringEscapeStrategy;
import io.github.cyfko.dashfilter.core.exception.InvalidValueShapeException;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.model.ValueRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PredicateBuilder")
class PredicateBuilderTest {

    private final PredicateBuilder builder = new PredicateBuilder();

    private String fragment(Operator operator, String column, String table, Object value) {
        PredicateResult result = builder.build(operator, column, table, value);
        assertTrue(result.isSuccess(), () -> "Expected success, got: " + result.getErrorMessage());
        return result.getFragment();
    }

    @Nested
    @DisplayName("Scalar operators")
    class ScalarTests {

        @Test
        @DisplayName("should quote strings and double embedded quotes")
        void shouldQuoteStrings() {
            assertEquals("stage = 'WON'", fragment(Operator.EQUALS, "stage", null, "WON"));
            assertEquals("name = 'O''Brien'", fragment(Operator.EQUALS, "name", null, "O'Brien"));
        }

        @Test
        @DisplayName("should emit numbers unquoted")
        void shouldEmitNumbersUnquoted() {
            assertEquals("amount > 1000", fragment(Operator.GT, "amount", null, 1000));
            assertEquals("amount >= 10.50", fragment(Operator.GTE, "amount", null, new BigDecimal("10.50")));
            assertEquals("amount < 2.5", fragment(Operator.LT, "amount", null, 2.5d));
            assertEquals("amount <= 7", fragment(Operator.LTE, "amount", null, 7L));
        }

        @Test
        @DisplayName("should qualify the column with its table")
        void shouldQualifyColumn() {
            assertEquals("d.stage = 'WON'", fragment(Operator.EQUALS, "stage", "d", "WON"));
        }

        @Test
        @DisplayName("should reject a collection for a single-value operator")
        void shouldRejectCollection() {
            PredicateResult result = builder.build(Operator.EQUALS, "stage", null, List.of("A", "B"));

            assertFalse(result.isSuccess());
            assertEquals(Operator.EQUALS, result.getOperator());
            assertThrows(InvalidValueShapeException.class, result::orElseThrow);
        }

        @Test
        @DisplayName("should reject null and non-finite numbers")
        void shouldRejectNullAndNaN() {
            assertFalse(builder.build(Operator.EQUALS, "amount", null, null).isSuccess());
            assertFalse(builder.build(Operator.GT, "amount", null, Double.NaN).isSuccess());
        }
    }

    @Nested
    @DisplayName("IN")
    class InTests {

        @Test
        @DisplayName("should join the values without spaces")
        void shouldJoinValues() {
            assertEquals("owner_id IN (1,2,3)", fragment(Operator.IN, "owner_id", null, List.of(1, 2, 3)));
            assertEquals("stage IN ('NEW','WON')", fragment(Operator.IN, "stage", null, new String[]{"NEW", "WON"}));
        }

        @Test
        @DisplayName("should reject an empty collection")
        void shouldRejectEmptyCollection() {
            PredicateResult result = builder.build(Operator.IN, "owner_id", null, List.of());
            assertFalse(result.isSuccess());
            assertTrue(result.getErrorMessage().contains("non-empty"));
        }

        @Test
        @DisplayName("should reject a scalar")
        void shouldRejectScalar() {
            assertFalse(builder.build(Operator.IN, "owner_id", null, 1).isSuccess());
        }

        @Test
        @DisplayName("should reject nested collections and null elements")
        void shouldRejectNestedElements() {
            assertFalse(builder.build(Operator.IN, "owner_id", null, List.of(List.of(1))).isSuccess());
            assertFalse(builder.build(Operator.IN, "owner_id", null, java.util.Arrays.asList(1, null)).isSuccess());
        }
    }

    @Nested
    @DisplayName("BETWEEN")
    class BetweenTests {

        @Test
        @DisplayName("should fail on a scalar value")
        void shouldFailOnScalar() {
            PredicateResult result = builder.build(Operator.BETWEEN, "created_at", null, 5);

            assertFalse(result.isSuccess());
            InvalidValueShapeException e = assertThrows(InvalidValueShapeException.class, result::orElseThrow);
            assertEquals(Operator.BETWEEN, e.getOperator());
        }

        @Test
        @DisplayName("should accept a from/to map")
        void shouldAcceptFromToMap() {
            Object value = Map.of("from", "2024-01-01", "to", "2024-02-01");

            assertEquals("created_at BETWEEN '2024-01-01' AND '2024-02-01'",
                    fragment(Operator.BETWEEN, "created_at", null, value));
        }

        @Test
        @DisplayName("should accept a range and a two-element list")
        void shouldAcceptRangeAndPair() {
            assertEquals("amount BETWEEN 10 AND 20", fragment(Operator.BETWEEN, "amount", null, ValueRange.of(10, 20)));
            assertEquals("amount BETWEEN 10 AND 20", fragment(Operator.BETWEEN, "amount", null, List.of(10, 20)));
        }

        @Test
        @DisplayName("should require both bounds")
        void shouldRequireBothBounds() {
            assertFalse(builder.build(Operator.BETWEEN, "amount", null, ValueRange.of(10, null)).isSuccess());
            assertFalse(builder.build(Operator.BETWEEN, "amount", null, List.of(1, 2, 3)).isSuccess());
        }
    }

    @Nested
    @DisplayName("LIKE")
    class LikeTests {

        @Test
        @DisplayName("should wrap the value in wildcards")
        void shouldWrapValue() {
            assertEquals("title LIKE '%acme%'", fragment(Operator.LIKE, "title", null, "acme"));
        }

        @Test
        @DisplayName("should escape user wildcards and quotes")
        void shouldEscapeWildcards() {
            assertEquals("title LIKE '%50\\% off\\_now%'", fragment(Operator.LIKE, "title", null, "50% off_now"));
            assertEquals("title LIKE '%l''oreal%'", fragment(Operator.LIKE, "title", null, "l'oreal"));
        }

        @Test
        @DisplayName("should reject a collection")
        void shouldRejectCollection() {
            assertFalse(builder.build(Operator.LIKE, "title", null, List.of("a")).isSuccess());
        }
    }

    @Nested
    @DisplayName("Date selectors")
    class DateTests {

        @Test
        @DisplayName("should format dates and timestamps as YYYY-MM-DD")
        void shouldFormatDates() {
            PredicateResult range = builder.build(Operator.BETWEEN, SelectorType.DATE_RANGE, "created_at", null,
                    ValueRange.of(LocalDate.of(2024, 1, 1), LocalDateTime.of(2024, 1, 31, 23, 59)));
            PredicateResult single = builder.build(Operator.EQUALS, SelectorType.SINGLE_DATE, "closed_on", null,
                    "2024-03-05T10:15:00Z");

            assertEquals("created_at BETWEEN '2024-01-01' AND '2024-01-31'", range.getFragment());
            assertEquals("closed_on = '2024-03-05'", single.getFragment());
        }

        @Test
        @DisplayName("should reject values that are not dates")
        void shouldRejectNonDates() {
            PredicateResult result = builder.build(Operator.EQUALS, SelectorType.SINGLE_DATE, "closed_on", null, "yesterday");

            assertFalse(result.isSuccess());
            assertTrue(result.getErrorMessage().contains("YYYY-MM-DD"));
        }
    }

    @Nested
    @DisplayName("Backslash escaping")
    class BackslashTests {

        private final PredicateBuilder mysql = new PredicateBuilder(StringEscapeStrategy.BACKSLASH);

        private String mysqlFragment(Operator operator, String column, Object value) {
            PredicateResult result = mysql.build(operator, column, null, value);
            assertTrue(result.isSuccess(), () -> "Expected success, got: " + result.getErrorMessage());
            return result.getFragment();
        }

        @Test
        @DisplayName("should keep a backslash before a quote inside the literal")
        void shouldNotLetBackslashCloseTheLiteral() {
            assertEquals("owner = 'x\\\\'' OR 1=1 -- '",
                    mysqlFragment(Operator.EQUALS, "owner", "x\\' OR 1=1 -- "));
        }

        @Test
        @DisplayName("should leave backslashes alone for standard databases")
        void shouldLeaveBackslashesForStandardDatabases() {
            assertEquals("path = 'a\\b'", fragment(Operator.EQUALS, "path", null, "a\\b"));
            assertEquals("owner = 'x\\'' OR 1=1 -- '", fragment(Operator.EQUALS, "owner", null, "x\\' OR 1=1 -- "));
        }

        @Test
        @DisplayName("should double backslashes in IN lists and LIKE patterns")
        void shouldEscapeEveryStringLiteral() {
            assertEquals("owner IN ('a\\\\b','c')", mysqlFragment(Operator.IN, "owner", List.of("a\\b", "c")));
            assertEquals("title LIKE '%50\\\\% off%'", mysqlFragment(Operator.LIKE, "title", "50% off"));
        }

        @Test
        @DisplayName("should leave numbers and dates untouched")
        void shouldLeaveNonTextUntouched() {
            assertEquals("amount > 10", mysqlFragment(Operator.GT, "amount", 10));
            PredicateResult date = mysql.build(Operator.EQUALS, SelectorType.SINGLE_DATE, "closed_on", null,
                    LocalDate.of(2024, 1, 31));
            assertEquals("closed_on = '2024-01-31'", date.getFragment());
        }

        @Test
        @DisplayName("should require an escape strategy")
        void shouldRequireStrategy() {
            assertThrows(NullPointerException.class, () -> new PredicateBuilder(null));
        }
    }

    @Nested
    @DisplayName("Selector and mapping")
    class MappingTests {

        @Test
        @DisplayName("mapping override replaces the selector default operator")
        void overrideReplacesDefault() {
            Selector selector = Selector.builder(1L, "amount", SelectorType.DROPDOWN).id(3L).build();
            SelectorMapping mapping = new SelectorMapping(null, 3L, 8L, "opportunity", "d", Operator.GTE);

            assertEquals("d.opportunity >= 500", builder.build(selector, mapping, 500).getFragment());
        }

        @Test
        @DisplayName("an unsafe column is a definition error, not a value error")
        void unsafeColumnIsDefinitionError() {
            assertThrows(SelectorDefinitionException.class,
                    () -> builder.build(Operator.EQUALS, "stage; DROP TABLE deals", null, "WON"));
            assertThrows(NullPointerException.class, () -> builder.build(null, "stage", null, "WON"));
        }
    }
}
