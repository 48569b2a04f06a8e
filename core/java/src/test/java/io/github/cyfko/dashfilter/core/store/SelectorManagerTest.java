package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownChartException;
import io.github.cyfko.dashfilter.core.exception.UnknownMappingException;
import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SelectorManager")
class SelectorManagerTest {

    private static final long DASHBOARD = 42L;
    private static final long CHART = 7L;

    @Mock
    private ChartRegistry chartRegistry;

    private InMemorySelectorStore selectorStore;
    private InMemoryMappingStore mappingStore;
    private SelectorManager manager;

    @BeforeEach
    void setUp() {
        selectorStore = new InMemorySelectorStore();
        mappingStore = new InMemoryMappingStore();
        manager = new SelectorManager(selectorStore, mappingStore, chartRegistry);

        when(chartRegistry.findChartQuery(anyLong())).thenReturn(Optional.empty());
        when(chartRegistry.findChartQuery(CHART))
                .thenReturn(Optional.of("SELECT d.stage, COUNT(*) FROM crm_deals d JOIN crm_users u ON u.id = d.owner_id GROUP BY d.stage"));
        when(chartRegistry.getChartColumns(CHART)).thenReturn(List.of("stage", "owner_id", "created_at"));
        when(chartRegistry.getChartTables(CHART)).thenReturn(List.of("crm_deals", "crm_users"));
    }

    private Selector create(String name, SelectorType type) {
        return manager.createSelector(Selector.builder(DASHBOARD, name, type).build());
    }

    @Nested
    @DisplayName("Selectors")
    class SelectorTests {

        @Test
        @DisplayName("should assign ids and list by sort order then id")
        void shouldListInDisplayOrder() {
            Selector late = manager.createSelector(Selector.builder(DASHBOARD, "late", SelectorType.TEXT).sortOrder(2).build());
            Selector first = manager.createSelector(Selector.builder(DASHBOARD, "first", SelectorType.TEXT).sortOrder(1).build());
            Selector second = manager.createSelector(Selector.builder(DASHBOARD, "second", SelectorType.TEXT).sortOrder(1).build());
            manager.createSelector(Selector.builder(99L, "elsewhere", SelectorType.TEXT).build());

            assertNotNull(late.id());
            assertEquals(List.of(first, second, late), manager.listSelectors(DASHBOARD));
        }

        @Test
        @DisplayName("should reject a duplicate name on the same dashboard only")
        void shouldRejectDuplicateName() {
            create("status", SelectorType.DROPDOWN);

            assertThrows(DuplicateDefinitionException.class, () -> create("status", SelectorType.TEXT));
            assertDoesNotThrow(() -> manager.createSelector(Selector.builder(99L, "status", SelectorType.TEXT).build()));
        }

        @Test
        @DisplayName("should reject a rename onto a taken name")
        void shouldRejectRenameOntoTakenName() {
            Selector status = create("status", SelectorType.DROPDOWN);
            create("owner", SelectorType.MULTI_SELECT);

            Selector renamed = Selector.builder(DASHBOARD, "owner", SelectorType.DROPDOWN).build();
            assertThrows(DuplicateDefinitionException.class, () -> manager.updateSelector(status.id(), renamed));

            Selector free = Selector.builder(DASHBOARD, "deal_status", SelectorType.DROPDOWN).build();
            assertEquals("deal_status", manager.updateSelector(status.id(), free).name());
        }

        @Test
        @DisplayName("should refuse to move a selector to another dashboard")
        void shouldRefuseMove() {
            Selector status = create("status", SelectorType.DROPDOWN);
            Selector moved = Selector.builder(99L, "status", SelectorType.DROPDOWN).build();

            assertThrows(SelectorDefinitionException.class, () -> manager.updateSelector(status.id(), moved));
        }

        @Test
        @DisplayName("should cascade delete to mappings")
        void shouldCascadeDelete() {
            Selector status = create("status", SelectorType.DROPDOWN);
            manager.addMapping(new SelectorMapping(status.id(), CHART, "stage"));

            manager.deleteSelector(status.id());

            assertTrue(mappingStore.findByChart(CHART).isEmpty());
            assertThrows(UnknownSelectorException.class, () -> manager.getSelector(status.id()));
            assertThrows(UnknownSelectorException.class, () -> manager.deleteSelector(status.id()));
        }
    }

    @Nested
    @DisplayName("Mappings")
    class MappingTests {

        @Test
        @DisplayName("should reject a mapping of an unknown selector or chart")
        void shouldRejectUnknownReferences() {
            Selector status = create("status", SelectorType.DROPDOWN);

            assertThrows(UnknownSelectorException.class, () -> manager.addMapping(new SelectorMapping(999L, CHART, "stage")));
            assertThrows(UnknownChartException.class, () -> manager.addMapping(new SelectorMapping(status.id(), 8L, "stage")));
        }

        @Test
        @DisplayName("should check column and table against the chart")
        void shouldCheckColumnAndTable() {
            Selector status = create("status", SelectorType.DROPDOWN);

            assertThrows(SelectorDefinitionException.class,
                    () -> manager.addMapping(new SelectorMapping(status.id(), CHART, "amount")));
            assertThrows(SelectorDefinitionException.class,
                    () -> manager.addMapping(new SelectorMapping(null, status.id(), CHART, "stage", "crm_leads", null)));

            assertNotNull(manager.addMapping(new SelectorMapping(null, status.id(), CHART, "STAGE", "crm_deals", null)).id());
            assertNotNull(manager.addMapping(new SelectorMapping(null, status.id(), CHART, "stage", "d", null)).id());
        }

        @Test
        @DisplayName("should skip checks the registry cannot answer")
        void shouldSkipUnknownColumns() {
            when(chartRegistry.getChartColumns(CHART)).thenReturn(List.of());
            Selector amount = create("amount", SelectorType.DROPDOWN);

            assertDoesNotThrow(() -> manager.addMapping(new SelectorMapping(amount.id(), CHART, "opportunity")));
        }

        @Test
        @DisplayName("should reject a duplicate mapping")
        void shouldRejectDuplicate() {
            Selector status = create("status", SelectorType.DROPDOWN);
            manager.addMapping(new SelectorMapping(status.id(), CHART, "stage"));

            assertThrows(DuplicateDefinitionException.class, () -> manager.addMapping(
                    new SelectorMapping(null, status.id(), CHART, "stage", null, Operator.LIKE)));
        }

        @Test
        @DisplayName("should accept and report overlapping mappings of different selectors")
        void shouldReportOverlaps() {
            Selector status = create("status", SelectorType.DROPDOWN);
            Selector stage = create("stage", SelectorType.MULTI_SELECT);
            Selector owner = create("owner", SelectorType.MULTI_SELECT);

            SelectorMapping a = manager.addMapping(new SelectorMapping(status.id(), CHART, "stage"));
            SelectorMapping b = manager.addMapping(new SelectorMapping(stage.id(), CHART, "stage"));
            manager.addMapping(new SelectorMapping(owner.id(), CHART, "owner_id"));

            assertEquals(List.of(a, b), manager.findOverlappingMappings(CHART));
        }

        @Test
        @DisplayName("should replace the mapping set of a selector atomically")
        void shouldReplaceMappings() {
            Selector status = create("status", SelectorType.DROPDOWN);
            SelectorMapping old = manager.addMapping(new SelectorMapping(status.id(), CHART, "stage"));

            List<SelectorMapping> duplicated = List.of(
                    new SelectorMapping(status.id(), CHART, "owner_id"),
                    new SelectorMapping(status.id(), CHART, "OWNER_ID"));
            assertThrows(DuplicateDefinitionException.class, () -> manager.replaceMappings(status.id(), duplicated));
            assertEquals(List.of(old), manager.listMappings(status.id()));

            List<SelectorMapping> saved = manager.replaceMappings(status.id(), List.of(
                    new SelectorMapping(999L, CHART, "owner_id"),
                    new SelectorMapping(status.id(), CHART, "created_at")));

            assertEquals(2, saved.size());
            assertTrue(saved.stream().allMatch(m -> m.selectorId() == status.id()));
            assertEquals(saved, manager.listMappings(status.id()));
        }

        @Test
        @DisplayName("should raise for unknown mappings")
        void shouldRaiseForUnknownMapping() {
            assertThrows(UnknownMappingException.class, () -> manager.deleteMapping(123L));
            assertThrows(UnknownMappingException.class, () -> manager.getMapping(123L));
        }
    }
}
