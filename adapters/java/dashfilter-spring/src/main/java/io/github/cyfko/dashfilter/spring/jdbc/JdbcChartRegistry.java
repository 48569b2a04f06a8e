package io.github.cyfko.dashfilter.spring.jdbc;

import io.github.cyfko.dashfilter.core.config.PatternConfig;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
import io.github.cyfko.dashfilter.spring.autoconfigure.DashFilterProperties;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ChartRegistry} reading chart queries from a chart table and placements from a
 * dashboard-chart link table.
 * <p>
 * Column names are not introspected: {@link #getChartColumns(long)} reports none, so mapping
 * validation only checks tables.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JdbcChartRegistry implements ChartRegistry {

    private final JdbcTemplate jdbcTemplate;
    private final String chartQuerySql;
    private final String dashboardChartsSql;

    public JdbcChartRegistry(JdbcTemplate jdbcTemplate, DashFilterProperties.Charts charts) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate cannot be null");
        String table = identifier(charts.getTable());
        String queryColumn = identifier(charts.getQueryColumn());
        String dashboardTable = identifier(charts.getDashboardTable());
        String sortColumn = identifier(charts.getSortColumn());

        this.chartQuerySql = "SELECT " + queryColumn + " FROM " + table + " WHERE id = ?";
        this.dashboardChartsSql = "SELECT chart_id FROM " + dashboardTable
                + " WHERE dashboard_id = ? ORDER BY " + sortColumn + ", id";
    }

    @Override
    public Optional<String> findChartQuery(long chartId) {
        List<String> queries = jdbcTemplate.queryForList(chartQuerySql, String.class, chartId);
        return queries.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public List<String> getChartColumns(long chartId) {
        return List.of();
    }

    @Override
    public List<Long> listDashboardCharts(long dashboardId) {
        return jdbcTemplate.queryForList(dashboardChartsSql, Long.class, dashboardId);
    }

    private static String identifier(String name) {
        if (!PatternConfig.isSqlIdentifier(name)) {
            throw new IllegalArgumentException("Invalid chart registry identifier: '" + name + "'");
        }
        return name;
    }
}
