package io.github.cyfko.dashfilter.core.spi;

import io.github.cyfko.dashfilter.core.model.QueryResult;

/**
 * Executes one composed chart query against the data store.
 * <p>
 * The executor owns blocking, row caps and statement timeouts. Any exception it throws is reported
 * on that chart only; it is never retried by the engine.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ChartQueryExecutor {

    /**
     * @param chartId chart the query belongs to, for logs and errors
     * @param sql     filtered query to run
     * @return the rows with row count and timing
     */
    QueryResult execute(long chartId, String sql);
}
