package io.github.cyfko.dashfilter.spring.jdbc;

import io.github.cyfko.dashfilter.core.config.ExecutionPolicy;
import io.github.cyfko.dashfilter.core.model.QueryResult;
import io.github.cyfko.dashfilter.core.spi.ChartQueryExecutor;
import io.github.cyfko.dashfilter.core.sql.SqlSafety;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Executes composed chart queries through a {@link JdbcTemplate}.
 * <p>
 * Before anything reaches the database the query is checked with {@link SqlSafety#requireReadOnly(String)}
 * and capped with a top-level {@code LIMIT}. The driver-side row cap and statement timeout come from the
 * {@link ExecutionPolicy}; the timeout is rounded up to whole seconds.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JdbcChartQueryExecutor implements ChartQueryExecutor {

    private static final Logger logger = Logger.getLogger(JdbcChartQueryExecutor.class.getName());

    private final JdbcTemplate jdbcTemplate;
    private final int maxRows;

    public JdbcChartQueryExecutor(JdbcTemplate jdbcTemplate, ExecutionPolicy policy) {
        Objects.requireNonNull(jdbcTemplate, "JdbcTemplate cannot be null");
        Objects.requireNonNull(policy, "Execution policy cannot be null");

        // dedicated template: row cap and timeout must not leak to the application's queries
        this.jdbcTemplate = new JdbcTemplate(Objects.requireNonNull(jdbcTemplate.getDataSource(),
                "JdbcTemplate has no DataSource"));
        this.jdbcTemplate.setMaxRows(policy.maxRows());
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, (policy.chartTimeout().toMillis() + 999) / 1000));
        this.maxRows = policy.maxRows();
    }

    @Override
    public QueryResult execute(long chartId, String sql) {
        SqlSafety.requireReadOnly(sql);
        String capped = SqlSafety.ensureLimit(sql, maxRows);

        long start = System.nanoTime();
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(capped);
        long elapsed = (System.nanoTime() - start) / 1_000_000;

        logger.fine(() -> String.format("Chart %d returned %d rows in %dms", chartId, rows.size(), elapsed));
        return QueryResult.of(rows, elapsed);
    }
}
