package io.github.cyfko.dashfilter.spring.autoconfigure;

import io.github.cyfko.dashfilter.core.config.ExecutionPolicy;
import io.github.cyfko.dashfilter.core.config.OptionPolicy;
import io.github.cyfko.dashfilter.core.config.StringEscapeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code dashfilter.*}.
 *
 * <pre>{@code
 * dashfilter:
 *   execution:
 *     chart-timeout: 10s
 *     max-rows: 5000
 *     parallelism: 8
 *   options:
 *     max-options: 200
 *     cast-type: CHAR
 *   sql:
 *     string-escape: BACKSLASH
 *   charts:
 *     table: ai_charts
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "dashfilter")
public class DashFilterProperties {

    private Execution execution = new Execution();
    private Options options = new Options();
    private Charts charts = new Charts();
    private Sql sql = new Sql();

    public static class Execution {
        private Duration chartTimeout = Duration.ofSeconds(5);
        private int maxRows = 10_000;
        private int parallelism = 4;

        public Duration getChartTimeout() { return chartTimeout; }
        public void setChartTimeout(Duration chartTimeout) { this.chartTimeout = chartTimeout; }
        public int getMaxRows() { return maxRows; }
        public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        ExecutionPolicy toPolicy() {
            return ExecutionPolicy.builder()
                    .chartTimeout(chartTimeout)
                    .maxRows(maxRows)
                    .parallelism(parallelism)
                    .build();
        }
    }

    public static class Options {
        private int maxOptions = 500;
        private String castType = "TEXT";

        public int getMaxOptions() { return maxOptions; }
        public void setMaxOptions(int maxOptions) { this.maxOptions = maxOptions; }
        public String getCastType() { return castType; }
        public void setCastType(String castType) { this.castType = castType; }

        OptionPolicy toPolicy() {
            return new OptionPolicy(maxOptions, castType);
        }
    }

    /**
     * Dialect settings for the literals written into chart queries. Use {@code BACKSLASH} for MySQL and
     * MariaDB unless {@code NO_BACKSLASH_ESCAPES} is set.
     */
    public static class Sql {
        private StringEscapeStrategy stringEscape = StringEscapeStrategy.STANDARD;

        public StringEscapeStrategy getStringEscape() { return stringEscape; }
        public void setStringEscape(StringEscapeStrategy stringEscape) { this.stringEscape = stringEscape; }
    }

    /**
     * Where the JDBC chart registry reads chart queries and dashboard placements.
     * Only used when the application does not declare its own {@code ChartRegistry}.
     */
    public static class Charts {
        /** Enables the JDBC chart registry. */
        private boolean enabled = true;
        private String table = "ai_charts";
        private String queryColumn = "sql_query";
        private String dashboardTable = "dashboard_charts";
        private String sortColumn = "sort_order";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
        public String getQueryColumn() { return queryColumn; }
        public void setQueryColumn(String queryColumn) { this.queryColumn = queryColumn; }
        public String getDashboardTable() { return dashboardTable; }
        public void setDashboardTable(String dashboardTable) { this.dashboardTable = dashboardTable; }
        public String getSortColumn() { return sortColumn; }
        public void setSortColumn(String sortColumn) { this.sortColumn = sortColumn; }
    }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Options getOptions() { return options; }
    public void setOptions(Options options) { this.options = options; }
    public Charts getCharts() { return charts; }
    public void setCharts(Charts charts) { this.charts = charts; }
    public Sql getSql() { return sql; }
    public void setSql(Sql sql) { this.sql = sql; }
}
