package io.github.cyfko.dashfilter.core.compose;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.exception.InvalidValueShapeException;
import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;
import io.github.cyfko.dashfilter.core.exception.MissingRequiredFilterException;
import io.github.cyfko.dashfilter.core.exception.UnknownChartException;
import io.github.cyfko.dashfilter.core.model.ChartComposition;
import io.github.cyfko.dashfilter.core.model.FilterValues;
import io.github.cyfko.dashfilter.core.model.PreviewRequest;
import io.github.cyfko.dashfilter.core.model.RewriteResult;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.model.ValueRange;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
import io.github.cyfko.dashfilter.core.store.InMemoryMappingStore;
import io.github.cyfko.dashfilter.core.store.InMemorySelectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("FilterComposer")
class FilterComposerTest {

    private static final long DASHBOARD = 42L;

    private static final String FUNNEL = "SELECT stage, COUNT(*) c FROM deals GROUP BY stage ORDER BY c DESC";
    private static final String OWNERS = "SELECT owner_id, SUM(amount) FROM deals WHERE created_at > '2023-01-01' GROUP BY owner_id";
    private static final String TREND = "SELECT created_at, amount FROM deals ORDER BY created_at";
    private static final String TABLE = "SELECT * FROM deals";

    @Mock
    private ChartRegistry chartRegistry;

    private InMemorySelectorStore selectorStore;
    private InMemoryMappingStore mappingStore;
    private FilterComposer composer;

    @BeforeEach
    void setUp() {
        selectorStore = new InMemorySelectorStore();
        mappingStore = new InMemoryMappingStore();
        composer = new FilterComposer(selectorStore, mappingStore, chartRegistry);

        when(chartRegistry.findChartQuery(anyLong())).thenReturn(Optional.empty());
        when(chartRegistry.findChartQuery(1L)).thenReturn(Optional.of(FUNNEL));
        when(chartRegistry.findChartQuery(2L)).thenReturn(Optional.of(OWNERS));
        when(chartRegistry.findChartQuery(3L)).thenReturn(Optional.of(TREND));
        when(chartRegistry.findChartQuery(4L)).thenReturn(Optional.of(TABLE));
        when(chartRegistry.listDashboardCharts(DASHBOARD)).thenReturn(List.of(1L, 2L, 3L, 4L));
    }

    private Selector selector(String name, SelectorType type) {
        return selectorStore.save(Selector.builder(DASHBOARD, name, type).build());
    }

    private SelectorMapping map(Selector selector, long chartId, String column) {
        return mappingStore.save(new SelectorMapping(selector.id(), chartId, column));
    }

    @Nested
    @DisplayName("Apply")
    class ApplyTests {

        @Test
        @DisplayName("should insert a WHERE before GROUP BY")
        void shouldFilterFunnel() {
            Selector status = selector("status", SelectorType.DROPDOWN);
            map(status, 1L, "stage");

            Map<Long, RewriteResult> results = composer.apply(DASHBOARD, FilterValues.builder().value("status", "WON").build());

            assertEquals("SELECT stage, COUNT(*) c FROM deals WHERE (stage = 'WON') GROUP BY stage ORDER BY c DESC",
                    results.get(1L).filteredSql());
        }

        @Test
        @DisplayName("should append to an existing WHERE")
        void shouldAppendToExistingWhere() {
            Selector owner = selector("owner", SelectorType.MULTI_SELECT);
            map(owner, 2L, "owner_id");

            Map<Long, RewriteResult> results = composer.apply(DASHBOARD,
                    FilterValues.builder().value("owner", List.of(1, 2, 3)).build());

            assertEquals("SELECT owner_id, SUM(amount) FROM deals WHERE created_at > '2023-01-01' "
                    + "AND (owner_id IN (1,2,3)) GROUP BY owner_id", results.get(2L).filteredSql());
        }

        @Test
        @DisplayName("fan-out: one selector filters three charts independently")
        void fanOut() {
            Selector status = selector("status", SelectorType.DROPDOWN);
            Selector owner = selector("owner", SelectorType.MULTI_SELECT);
            map(status, 1L, "stage");
            map(status, 2L, "stage");
            map(status, 3L, "stage");
            map(owner, 4L, "owner_id");

            Map<Long, RewriteResult> results = composer.apply(DASHBOARD, FilterValues.builder().value("status", "WON").build());

            assertEquals("WHERE (stage = 'WON')", results.get(1L).whereClause());
            assertEquals("AND (stage = 'WON')", results.get(2L).whereClause());
            assertEquals("WHERE (stage = 'WON')", results.get(3L).whereClause());
            assertFalse(results.get(4L).isFiltered());
            assertEquals(TABLE, results.get(4L).filteredSql());
        }

        @Test
        @DisplayName("fan-in: predicates of several selectors are ANDed in mapping order")
        void fanIn() {
            Selector status = selector("status", SelectorType.DROPDOWN);
            Selector period = selector("period", SelectorType.DATE_RANGE);
            Selector owner = selector("owner", SelectorType.MULTI_SELECT);
            map(period, 3L, "created_at");
            map(owner, 3L, "owner_id");
            map(status, 3L, "stage");

            FilterValues values = FilterValues.builder()
                    .value("status", "WON")
                    .value("owner", List.of(5))
                    .value("period", Map.of("from", "2024-01-01", "to", "2024-02-01"))
                    .build();

            assertEquals("WHERE (created_at BETWEEN '2024-01-01' AND '2024-02-01') AND (owner_id IN (5)) AND (stage = 'WON')",
                    composer.apply(DASHBOARD, values).get(3L).whereClause());
        }

        @Test
        @DisplayName("should apply the mapping operator override")
        void shouldApplyOverride() {
            Selector amount = selector("amount", SelectorType.DROPDOWN);
            mappingStore.save(new SelectorMapping(null, amount.id(), 4L, "amount", null, Operator.GTE));

            assertEquals("SELECT * FROM deals WHERE (amount >= 1000)",
                    composer.apply(DASHBOARD, FilterValues.builder().value("amount", 1000).build()).get(4L).filteredSql());
        }

        @Test
        @DisplayName("inactive values and unknown names leave the charts untouched")
        void inactiveValuesAreIgnored() {
            Selector status = selector("status", SelectorType.DROPDOWN);
            Selector owner = selector("owner", SelectorType.MULTI_SELECT);
            map(status, 1L, "stage");
            map(owner, 2L, "owner_id");

            FilterValues values = FilterValues.builder()
                    .value("status", "")
                    .value("owner", List.of())
                    .value("nobody", "x")
                    .build();
            Map<Long, RewriteResult> results = composer.apply(DASHBOARD, values);

            assertEquals(List.of(1L, 2L, 3L, 4L), List.copyOf(results.keySet()));
            assertTrue(results.values().stream().noneMatch(RewriteResult::isFiltered));
        }

        @Test
        @DisplayName("should fail fast when a required selector has no value")
        void shouldRequireMandatoryFilters() {
            selectorStore.save(Selector.builder(DASHBOARD, "period", SelectorType.DATE_RANGE).required(true).build());
            selectorStore.save(Selector.builder(DASHBOARD, "region", SelectorType.DROPDOWN).required(true).build());

            MissingRequiredFilterException e = assertThrows(MissingRequiredFilterException.class,
                    () -> composer.compose(DASHBOARD, FilterValues.builder().value("period", ValueRange.of("", null)).build()));

            assertEquals(List.of("period", "region"), e.getSelectorNames());
        }

        @Test
        @DisplayName("should include mapped charts missing from the dashboard list")
        void shouldIncludeMappedCharts() {
            when(chartRegistry.listDashboardCharts(DASHBOARD)).thenReturn(List.of(1L));
            Selector status = selector("status", SelectorType.DROPDOWN);
            map(status, 4L, "stage");

            assertEquals(List.of(1L, 4L), List.copyOf(composer.apply(DASHBOARD, FilterValues.empty()).keySet()));
        }

        @Test
        @DisplayName("should be deterministic and leave the stores untouched")
        void shouldBeDeterministic() {
            Selector status = selector("status", SelectorType.DROPDOWN);
            map(status, 1L, "stage");
            FilterValues values = FilterValues.builder().value("status", "WON").build();

            assertEquals(composer.apply(DASHBOARD, values), composer.apply(DASHBOARD, values));
            assertEquals(List.of(status), selectorStore.findByDashboard(DASHBOARD));
            assertEquals(1, mappingStore.findByChart(1L).size());
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class IsolationTests {

        @Test
        @DisplayName("a bad value or query fails its chart only")
        void failuresStayPerChart() {
            when(chartRegistry.findChartQuery(3L)).thenReturn(Optional.of("SELECT * FROM (SELECT 1"));
            Selector period = selector("period", SelectorType.DATE_RANGE);
            Selector status = selector("status", SelectorType.DROPDOWN);
            map(status, 1L, "stage");
            map(status, 3L, "stage");
            map(period, 2L, "created_at");

            FilterValues values = FilterValues.builder().value("status", "WON").value("period", "2024-01-01").build();
            Map<Long, ChartComposition> compositions = composer.compose(DASHBOARD, values);

            assertTrue(compositions.get(1L).isSuccess());
            assertEquals(1, compositions.get(1L).predicateCount());
            assertInstanceOf(InvalidValueShapeException.class, compositions.get(2L).error());
            assertInstanceOf(MalformedQueryException.class, compositions.get(3L).error());
            assertTrue(compositions.get(4L).isSuccess());
        }

        @Test
        @DisplayName("apply raises the first chart error")
        void applyRaisesFirstError() {
            when(chartRegistry.listDashboardCharts(DASHBOARD)).thenReturn(List.of(1L, 99L));

            assertThrows(UnknownChartException.class, () -> composer.apply(DASHBOARD, FilterValues.empty()));
        }
    }

    @Nested
    @DisplayName("Preview")
    class PreviewTests {

        @Test
        @DisplayName("should preview an unsaved mapping")
        void shouldPreviewUnsavedMapping() {
            RewriteResult result = composer.preview(PreviewRequest.builder(1L, "stage")
                    .selectorName("status")
                    .selectorType(SelectorType.DROPDOWN)
                    .operator(Operator.EQUALS)
                    .sampleValue("WON")
                    .build());

            assertEquals(FUNNEL, result.originalSql());
            assertEquals("WHERE (stage = 'WON')", result.whereClause());
        }

        @Test
        @DisplayName("should take type and operator from a stored selector")
        void shouldUseStoredSelectorDefaults() {
            Selector owner = selector("owner", SelectorType.MULTI_SELECT);

            RewriteResult result = composer.preview(PreviewRequest.builder(4L, "owner_id")
                    .selectorId(owner.id())
                    .targetTable("deals")
                    .sampleValue(7)
                    .build());

            assertEquals("SELECT * FROM deals WHERE (deals.owner_id IN (7))", result.filteredSql());
        }

        @Test
        @DisplayName("should use placeholders for a blank sample")
        void shouldUsePlaceholders() {
            RewriteResult text = composer.preview(PreviewRequest.builder(4L, "title").selectorType(SelectorType.TEXT).build());
            RewriteResult range = composer.preview(PreviewRequest.builder(4L, "created_at")
                    .selectorType(SelectorType.DATE_RANGE).sampleValue("").build());
            RewriteResult between = composer.preview(PreviewRequest.builder(4L, "amount")
                    .operator(Operator.BETWEEN).sampleValue(10).build());

            assertEquals("WHERE (title LIKE '%example\\_value%')", text.whereClause());
            assertEquals("WHERE (created_at BETWEEN '2024-01-01' AND '2024-12-31')", range.whereClause());
            assertEquals("WHERE (amount BETWEEN 10 AND 10)", between.whereClause());
        }

        @Test
        @DisplayName("should surface a query that cannot be previewed")
        void shouldSurfaceMalformedQuery() {
            when(chartRegistry.findChartQuery(5L)).thenReturn(Optional.of("SELECT a FROM t UNION SELECT a FROM u"));

            assertThrows(MalformedQueryException.class,
                    () -> composer.preview(PreviewRequest.builder(5L, "a").sampleValue("x").build()));
            assertThrows(UnknownChartException.class,
                    () -> composer.preview(PreviewRequest.builder(6L, "a").sampleValue("x").build()));
        }
    }
}
