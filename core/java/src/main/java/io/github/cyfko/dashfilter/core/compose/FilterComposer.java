package io.github.cyfko.dashfilter.core.compose;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.api.ValueArity;
import io.github.cyfko.dashfilter.core.exception.InvalidValueShapeException;
import io.github.cyfko.dashfilter.core.exception.MalformedQueryException;
import io.github.cyfko.dashfilter.core.exception.MissingRequiredFilterException;
import io.github.cyfko.dashfilter.core.exception.UnknownChartException;
import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.ChartComposition;
import io.github.cyfko.dashfilter.core.model.FilterValues;
import io.github.cyfko.dashfilter.core.model.PreviewRequest;
import io.github.cyfko.dashfilter.core.model.RewriteResult;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.model.ValueRange;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
import io.github.cyfko.dashfilter.core.sql.PredicateBuilder;
import io.github.cyfko.dashfilter.core.sql.QueryRewriter;
import io.github.cyfko.dashfilter.core.store.MappingStore;
import io.github.cyfko.dashfilter.core.store.SelectorStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns selector values into rewritten chart queries.
 *
 * <h2>Apply</h2>
 * <ol>
 *   <li>Load the dashboard's selectors; fail with {@link MissingRequiredFilterException} if a required
 *       selector has no active value.</li>
 *   <li>Load the mappings of the selectors with an active value and group them by chart, in
 *       mapping insertion order.</li>
 *   <li>Per chart: build one predicate per mapping and rewrite the chart's original query once
 *       with all of them.</li>
 * </ol>
 * <p>
 * Charts are composed independently: a failure (bad value shape, unparseable query, unknown chart)
 * is recorded on that chart's {@link ChartComposition} and siblings carry on. Charts without an active
 * mapping are returned unchanged. The result covers the dashboard's charts as listed by the
 * {@link ChartRegistry}, followed by any other chart a selector of the dashboard is mapped to.
 * </p>
 *
 * <h2>Preview</h2>
 * <p>
 * Previews one mapping that may not exist yet against a chart, with an editor-supplied sample value.
 * The sample is never checked against the selector's options.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FilterComposer composer = new FilterComposer(selectorStore, mappingStore, chartRegistry);
 *
 * Map<Long, RewriteResult> queries = composer.apply(42L, FilterValues.builder()
 *     .value("status", "WON")
 *     .value("owner", List.of(1, 2, 3))
 *     .build());
 * }</pre>
 * <p>
 * The composer only reads the stores and holds no mutable state; it is thread-safe when they are.
 * Identical inputs always produce identical output.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterComposer {

    private static final Logger logger = Logger.getLogger(FilterComposer.class.getName());

    static final String PLACEHOLDER_TEXT = "example_value";
    static final String PLACEHOLDER_DATE = "2024-01-01";
    static final String PLACEHOLDER_DATE_END = "2024-12-31";

    private final SelectorStore selectorStore;
    private final MappingStore mappingStore;
    private final ChartRegistry chartRegistry;
    private final PredicateBuilder predicateBuilder;
    private final QueryRewriter queryRewriter;

    public FilterComposer(SelectorStore selectorStore, MappingStore mappingStore, ChartRegistry chartRegistry) {
        this(selectorStore, mappingStore, chartRegistry, new PredicateBuilder(), new QueryRewriter());
    }

    public FilterComposer(SelectorStore selectorStore,
                          MappingStore mappingStore,
                          ChartRegistry chartRegistry,
                          PredicateBuilder predicateBuilder,
                          QueryRewriter queryRewriter) {
        this.selectorStore = Objects.requireNonNull(selectorStore, "selectorStore");
        this.mappingStore = Objects.requireNonNull(mappingStore, "mappingStore");
        this.chartRegistry = Objects.requireNonNull(chartRegistry, "chartRegistry");
        this.predicateBuilder = Objects.requireNonNull(predicateBuilder, "predicateBuilder");
        this.queryRewriter = Objects.requireNonNull(queryRewriter, "queryRewriter");
    }

    /**
     * Previews one hypothetical mapping against a chart.
     * <p>
     * Type and operator come from the request, then from the referenced selector, then from the type's
     * default. A blank sample is replaced by a placeholder; a single sample is widened to a one-element
     * list for {@code in} and to the range {@code (v, v)} for {@code between}.
     * </p>
     *
     * @param request preview request
     * @return original and filtered query of the chart
     * @throws UnknownChartException       if the chart does not exist
     * @throws UnknownSelectorException    if a selector id is given and does not exist
     * @throws InvalidValueShapeException  if the sample does not fit the operator
     * @throws MalformedQueryException     if the chart query cannot be rewritten
     */
    public RewriteResult preview(PreviewRequest request) {
        String query = chartRegistry.findChartQuery(request.chartId())
                .orElseThrow(() -> new UnknownChartException(request.chartId()));

        Selector selector = null;
        if (request.selectorId() != null) {
            long selectorId = request.selectorId();
            selector = selectorStore.findById(selectorId).orElseThrow(() -> new UnknownSelectorException(selectorId));
        }

        SelectorType type = request.selectorType() != null ? request.selectorType()
                : selector != null ? selector.type() : null;
        Operator operator = request.operator() != null ? request.operator()
                : selector != null ? selector.defaultOperator()
                : type != null ? type.getDefaultOperator() : Operator.EQUALS;

        Object sample = shapeSample(request.sampleValue(), type, operator);
        String predicate = predicateBuilder
                .build(operator, type, request.targetColumn(), request.targetTable(), sample)
                .orElseThrow();

        RewriteResult result = queryRewriter.rewrite(query, List.of(predicate));
        logger.fine(() -> "Preview of " + (request.selectorName() != null ? request.selectorName() : "mapping")
                + " on chart " + request.chartId() + ": " + result.whereClause());
        return result;
    }

    /**
     * Composes every chart of a dashboard, isolating failures per chart.
     *
     * @param dashboardId  dashboard identifier
     * @param filterValues viewer filter values keyed by selector name
     * @return one composition per chart, dashboard charts first
     * @throws MissingRequiredFilterException if a required selector has no active value
     */
    public Map<Long, ChartComposition> compose(long dashboardId, FilterValues filterValues) {
        long start = System.nanoTime();
        List<Selector> selectors = selectorStore.findByDashboard(dashboardId);

        requireMandatoryValues(selectors, filterValues);
        logIgnoredNames(dashboardId, selectors, filterValues);

        Map<Long, Selector> active = new LinkedHashMap<>();
        for (Selector selector : selectors) {
            if (filterValues.isActive(selector.name())) {
                active.put(selector.id(), selector);
            }
        }

        List<SelectorMapping> mappings = mappingStore.findBySelectors(
                selectors.stream().map(Selector::id).toList());

        Set<Long> chartIds = new LinkedHashSet<>(chartRegistry.listDashboardCharts(dashboardId));
        Map<Long, List<SelectorMapping>> activeByChart = new LinkedHashMap<>();
        for (SelectorMapping mapping : mappings) {
            chartIds.add(mapping.chartId());
            if (active.containsKey(mapping.selectorId())) {
                activeByChart.computeIfAbsent(mapping.chartId(), id -> new ArrayList<>()).add(mapping);
            }
        }

        Map<Long, ChartComposition> compositions = new LinkedHashMap<>();
        for (Long chartId : chartIds) {
            List<SelectorMapping> chartMappings = activeByChart.getOrDefault(chartId, List.of());
            compositions.put(chartId, composeChart(chartId, chartMappings, active, filterValues));
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        logger.info(() -> String.format("Composed dashboard %d in %dms: %d chart(s), %d active selector(s)",
                dashboardId, durationMs, compositions.size(), active.size()));
        return compositions;
    }

    /**
     * Strict variant of {@link #compose(long, FilterValues)}: the first chart failure is thrown.
     *
     * @param dashboardId  dashboard identifier
     * @param filterValues viewer filter values keyed by selector name
     * @return rewritten query per chart
     * @throws MissingRequiredFilterException if a required selector has no active value
     * @throws RuntimeException the error of the first chart that could not be composed
     */
    public Map<Long, RewriteResult> apply(long dashboardId, FilterValues filterValues) {
        Map<Long, RewriteResult> results = new LinkedHashMap<>();
        for (ChartComposition composition : compose(dashboardId, filterValues).values()) {
            if (!composition.isSuccess()) {
                throw composition.error();
            }
            results.put(composition.chartId(), composition.result());
        }
        return results;
    }

    /**
     * Composes a single chart with the values of the given selectors.
     */
    private ChartComposition composeChart(long chartId,
                                          List<SelectorMapping> mappings,
                                          Map<Long, Selector> selectors,
                                          FilterValues filterValues) {
        try {
            String query = chartRegistry.findChartQuery(chartId).orElseThrow(() -> new UnknownChartException(chartId));
            if (mappings.isEmpty()) {
                return ChartComposition.success(chartId, RewriteResult.unchanged(query), 0);
            }

            List<String> predicates = new ArrayList<>(mappings.size());
            for (SelectorMapping mapping : mappings) {
                Selector selector = selectors.get(mapping.selectorId());
                predicates.add(predicateBuilder.build(selector, mapping, filterValues.get(selector.name())).orElseThrow());
            }
            RewriteResult result = queryRewriter.rewrite(query, predicates);
            logger.fine(() -> "Chart " + chartId + ": " + result.whereClause());
            return ChartComposition.success(chartId, result, predicates.size());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Chart " + chartId + " could not be composed: " + e.getMessage());
            return ChartComposition.failure(chartId, e);
        }
    }

    private static void requireMandatoryValues(Collection<Selector> selectors, FilterValues filterValues) {
        List<String> missing = selectors.stream()
                .filter(Selector::required)
                .map(Selector::name)
                .filter(name -> !filterValues.isActive(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFilterException(missing);
        }
    }

    private static void logIgnoredNames(long dashboardId, Collection<Selector> selectors, FilterValues filterValues) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        Set<String> known = selectors.stream().map(Selector::name).collect(Collectors.toSet());
        for (String name : filterValues.values().keySet()) {
            if (!known.contains(name)) {
                logger.fine(() -> "Ignoring value of unknown selector '" + name + "' on dashboard " + dashboardId);
            }
        }
    }

    static Object shapeSample(Object sample, SelectorType type, Operator operator) {
        Object value = FilterValues.isInactive(sample) ? placeholder(type, operator) : sample;

        ValueArity arity = operator.getArity();
        boolean scalar = !(value instanceof Collection<?>) && !(value instanceof Map<?, ?>)
                && !(value instanceof ValueRange) && !value.getClass().isArray();
        if (scalar && arity == ValueArity.MULTIPLE) {
            return List.of(value);
        }
        if (scalar && arity == ValueArity.PAIR) {
            return new ValueRange(value, value);
        }
        return value;
    }

    private static Object placeholder(SelectorType type, Operator operator) {
        boolean temporal = type != null && type.isTemporal();
        if (operator.getArity() == ValueArity.PAIR && temporal) {
            return new ValueRange(PLACEHOLDER_DATE, PLACEHOLDER_DATE_END);
        }
        return temporal ? PLACEHOLDER_DATE : PLACEHOLDER_TEXT;
    }
}
