package io.github.cyfko.dashfilter.core.spi;

import io.github.cyfko.dashfilter.core.sql.SqlInspector;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the charts the filters are applied to.
 * <p>
 * Charts are owned elsewhere (the chart authoring flow); this engine only reads their current query
 * and, for mapping validation, their columns and tables. Implementations must be thread-safe: the
 * renderer calls them from worker threads.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class JdbcChartRegistry implements ChartRegistry {
 *     public Optional<String> findChartQuery(long chartId) {
 *         return jdbc.query("SELECT sql_query FROM ai_charts WHERE id = ?",
 *                 rs -> rs.next() ? Optional.of(rs.getString(1)) : Optional.empty(), chartId);
 *     }
 *     public List<String> getChartColumns(long chartId) {
 *         return List.of(); // unknown: column checks are skipped
 *     }
 *     public List<Long> listDashboardCharts(long dashboardId) {
 *         return jdbc.queryForList("SELECT chart_id FROM dashboard_charts WHERE dashboard_id = ?",
 *                 Long.class, dashboardId);
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ChartRegistry {

    /**
     * Returns the chart's current query as authored.
     *
     * @param chartId chart identifier
     * @return the query, or empty when the chart does not exist
     */
    Optional<String> findChartQuery(long chartId);

    /**
     * Returns the column names the chart's query exposes or reads.
     *
     * @param chartId chart identifier
     * @return column names, empty when unknown (column checks are then skipped)
     */
    List<String> getChartColumns(long chartId);

    /**
     * Returns the tables the chart's query reads.
     * <p>
     * Defaults to the tables named after {@code FROM} and {@code JOIN} in the chart query.
     * </p>
     *
     * @param chartId chart identifier
     * @return table names, empty when unknown (table checks are then skipped)
     */
    default List<String> getChartTables(long chartId) {
        return findChartQuery(chartId).map(SqlInspector::referencedTables).orElse(List.of());
    }

    /**
     * Returns the charts placed on a dashboard, in display order.
     *
     * @param dashboardId dashboard identifier
     * @return chart identifiers
     */
    List<Long> listDashboardCharts(long dashboardId);
}
