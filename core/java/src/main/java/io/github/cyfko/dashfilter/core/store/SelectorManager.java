package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownChartException;
import io.github.cyfko.dashfilter.core.exception.UnknownMappingException;
import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
import io.github.cyfko.dashfilter.core.sql.SqlInspector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point for editing selectors and their chart mappings.
 * <p>
 * Wraps the two stores with the rules that span several entities: a mapping must reference an existing
 * selector and chart, its column and table must belong to the chart when the {@link ChartRegistry} can
 * tell, deleting a selector removes its mappings. Composition only reads the stores and never goes
 * through this class.
 * </p>
 *
 * <h2>Overlapping mappings</h2>
 * <p>
 * Two mappings of different selectors on the same chart column are accepted: both predicates are
 * combined with {@code AND}, which narrows the result and may or may not be intended. Saving such a
 * mapping logs a warning and {@link #findOverlappingMappings(long)} lists them for review.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SelectorManager manager = new SelectorManager(selectorStore, mappingStore, chartRegistry);
 *
 * Selector status = manager.createSelector(Selector.builder(42L, "status", SelectorType.DROPDOWN).build());
 * manager.addMapping(new SelectorMapping(status.id(), 7L, "stage"));
 *
 * manager.deleteSelector(status.id()); // mappings go with it
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SelectorManager {

    private static final Logger logger = Logger.getLogger(SelectorManager.class.getName());

    private final SelectorStore selectorStore;
    private final MappingStore mappingStore;
    private final ChartRegistry chartRegistry;

    public SelectorManager(SelectorStore selectorStore, MappingStore mappingStore, ChartRegistry chartRegistry) {
        this.selectorStore = Objects.requireNonNull(selectorStore, "selectorStore");
        this.mappingStore = Objects.requireNonNull(mappingStore, "mappingStore");
        this.chartRegistry = Objects.requireNonNull(chartRegistry, "chartRegistry");
    }

    // ---------------------------------------------------------------- selectors

    /**
     * Creates a selector.
     *
     * @param selector selector without id
     * @return the stored selector
     * @throws DuplicateDefinitionException if the dashboard already has a selector with that name
     */
    public Selector createSelector(Selector selector) {
        if (selector.id() != null) {
            throw new SelectorDefinitionException("New selector must not carry an id, got " + selector.id());
        }
        Selector saved = selectorStore.save(selector);
        logger.info(() -> "Created selector '" + saved.name() + "' (id=" + saved.id()
                + ") on dashboard " + saved.dashboardId());
        return saved;
    }

    /**
     * Replaces a selector definition. The dashboard cannot change.
     * <p>
     * A rename is accepted when the new name is free on the dashboard. Filter values saved by callers
     * under the old name no longer apply.
     * </p>
     *
     * @throws UnknownSelectorException     if no selector has that id
     * @throws DuplicateDefinitionException if the new name is taken
     */
    public Selector updateSelector(long selectorId, Selector selector) {
        Selector current = getSelector(selectorId);
        if (current.dashboardId() != selector.dashboardId()) {
            throw new SelectorDefinitionException("Selector " + selectorId + " cannot move from dashboard "
                    + current.dashboardId() + " to " + selector.dashboardId());
        }
        Selector saved = selectorStore.save(selector.withId(selectorId));
        if (!current.name().equals(saved.name())) {
            logger.warning(() -> "Selector " + selectorId + " renamed from '" + current.name() + "' to '"
                    + saved.name() + "': filter values keyed by the old name are ignored from now on");
        }
        return saved;
    }

    /**
     * @throws UnknownSelectorException if no selector has that id
     */
    public Selector getSelector(long selectorId) {
        return selectorStore.findById(selectorId).orElseThrow(() -> new UnknownSelectorException(selectorId));
    }

    /**
     * @return the dashboard's selectors ordered by {@code (sortOrder, id)}
     */
    public List<Selector> listSelectors(long dashboardId) {
        return selectorStore.findByDashboard(dashboardId);
    }

    /**
     * Deletes a selector and all its mappings.
     *
     * @throws UnknownSelectorException if no selector has that id
     */
    public void deleteSelector(long selectorId) {
        Selector selector = getSelector(selectorId);
        int removed = mappingStore.deleteBySelector(selectorId);
        selectorStore.deleteById(selectorId);
        logger.info(() -> "Deleted selector '" + selector.name() + "' (id=" + selectorId + ") and "
                + removed + " mapping(s)");
    }

    // ---------------------------------------------------------------- mappings

    /**
     * Adds a mapping after checking the selector, the chart and the target.
     *
     * @param mapping mapping without id
     * @return the stored mapping
     * @throws UnknownSelectorException     if the selector does not exist
     * @throws UnknownChartException        if the chart registry does not know the chart
     * @throws SelectorDefinitionException  if the column or table does not belong to the chart
     * @throws DuplicateDefinitionException if the selector already maps this chart column
     */
    public SelectorMapping addMapping(SelectorMapping mapping) {
        if (mapping.id() != null) {
            throw new SelectorDefinitionException("New mapping must not carry an id, got " + mapping.id());
        }
        validateMapping(mapping);
        SelectorMapping saved = mappingStore.save(mapping);
        warnOnOverlap(saved);
        logger.fine(() -> "Mapped selector " + saved.selectorId() + " to " + saved.qualifiedColumn()
                + " on chart " + saved.chartId());
        return saved;
    }

    /**
     * Replaces a mapping.
     *
     * @throws UnknownMappingException if no mapping has that id
     */
    public SelectorMapping updateMapping(long mappingId, SelectorMapping mapping) {
        getMapping(mappingId);
        validateMapping(mapping);
        SelectorMapping saved = mappingStore.save(mapping.withId(mappingId));
        warnOnOverlap(saved);
        return saved;
    }

    /**
     * @throws UnknownMappingException if no mapping has that id
     */
    public SelectorMapping getMapping(long mappingId) {
        return mappingStore.findById(mappingId).orElseThrow(() -> new UnknownMappingException(mappingId));
    }

    /**
     * @throws UnknownSelectorException if the selector does not exist
     */
    public List<SelectorMapping> listMappings(long selectorId) {
        getSelector(selectorId);
        return mappingStore.findBySelector(selectorId);
    }

    public List<SelectorMapping> listChartMappings(long chartId) {
        return mappingStore.findByChart(chartId);
    }

    /**
     * @throws UnknownMappingException if no mapping has that id
     */
    public void deleteMapping(long mappingId) {
        if (!mappingStore.deleteById(mappingId)) {
            throw new UnknownMappingException(mappingId);
        }
        logger.fine(() -> "Deleted mapping " + mappingId);
    }

    /**
     * Replaces every mapping of a selector with the given set, as saved by the graph editor.
     * <p>
     * All mappings are validated before anything is removed; a rejected set leaves the stored
     * mappings untouched.
     * </p>
     *
     * @param selectorId selector whose mappings are replaced
     * @param mappings   new mappings; their {@code selectorId} is forced to {@code selectorId}
     * @return the stored mappings, in the given order
     * @throws DuplicateDefinitionException if the set maps the same chart column twice
     */
    public List<SelectorMapping> replaceMappings(long selectorId, List<SelectorMapping> mappings) {
        getSelector(selectorId);

        List<SelectorMapping> accepted = new ArrayList<>(mappings.size());
        for (SelectorMapping mapping : mappings) {
            SelectorMapping candidate = new SelectorMapping(null, selectorId, mapping.chartId(),
                    mapping.targetColumn(), mapping.targetTable(), mapping.operatorOverride());
            validateMapping(candidate);
            for (SelectorMapping other : accepted) {
                if (other.duplicates(candidate)) {
                    throw new DuplicateDefinitionException("Mapping to " + candidate.qualifiedColumn()
                            + " on chart " + candidate.chartId() + " appears twice");
                }
            }
            accepted.add(candidate);
        }

        int removed = mappingStore.deleteBySelector(selectorId);
        List<SelectorMapping> saved = new ArrayList<>(accepted.size());
        for (SelectorMapping mapping : accepted) {
            SelectorMapping stored = mappingStore.save(mapping);
            warnOnOverlap(stored);
            saved.add(stored);
        }
        logger.info(() -> "Replaced " + removed + " mapping(s) of selector " + selectorId + " with " + saved.size());
        return saved;
    }

    /**
     * Lists the mappings of a chart whose target is also used by a mapping of another selector.
     *
     * @param chartId chart identifier
     * @return overlapping mappings in insertion order
     */
    public List<SelectorMapping> findOverlappingMappings(long chartId) {
        List<SelectorMapping> chartMappings = mappingStore.findByChart(chartId);
        List<SelectorMapping> overlapping = new ArrayList<>();
        for (SelectorMapping mapping : chartMappings) {
            for (SelectorMapping other : chartMappings) {
                if (other.selectorId() != mapping.selectorId() && other.sameTarget(mapping)) {
                    overlapping.add(mapping);
                    break;
                }
            }
        }
        return overlapping;
    }

    private void validateMapping(SelectorMapping mapping) {
        getSelector(mapping.selectorId());

        long chartId = mapping.chartId();
        String chartQuery = chartRegistry.findChartQuery(chartId).orElseThrow(() -> new UnknownChartException(chartId));

        List<String> columns = chartRegistry.getChartColumns(chartId);
        if (!columns.isEmpty() && !containsIgnoreCase(columns, mapping.targetColumn())) {
            throw new SelectorDefinitionException("Column '" + mapping.targetColumn()
                    + "' is not available on chart " + chartId + ": " + String.join(", ", columns));
        }

        if (mapping.targetTable() != null) {
            List<String> tables = readable(() -> chartRegistry.getChartTables(chartId));
            if (!tables.isEmpty() && !containsIgnoreCase(tables, mapping.targetTable())
                    && !containsIgnoreCase(readable(() -> SqlInspector.tableAliases(chartQuery)), mapping.targetTable())) {
                throw new SelectorDefinitionException("Table '" + mapping.targetTable()
                        + "' is not used by chart " + chartId + ": " + String.join(", ", tables));
            }
        }
    }

    private static List<String> readable(Supplier<List<String>> names) {
        try {
            return names.get();
        } catch (MalformedQueryException e) {
            logger.fine(() -> "Chart query cannot be inspected, table check skipped: " + e.getMessage());
            return List.of();
        }
    }

    private void warnOnOverlap(SelectorMapping saved) {
        for (SelectorMapping other : mappingStore.findByChart(saved.chartId())) {
            if (other.selectorId() != saved.selectorId() && other.sameTarget(saved)) {
                logger.warning(() -> "Selectors " + other.selectorId() + " and " + saved.selectorId()
                        + " both filter " + saved.qualifiedColumn() + " on chart " + saved.chartId()
                        + "; their predicates are combined with AND");
                return;
            }
        }
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return names.stream().anyMatch(n -> n != null && n.toLowerCase(Locale.ROOT).equals(wanted));
    }
}
