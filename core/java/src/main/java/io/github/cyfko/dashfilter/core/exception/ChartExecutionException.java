package io.github.cyfko.dashfilter.core.exception;

/**
 * Exception thrown by a {@link io.github.cyfko.dashfilter.core.spi.ChartQueryExecutor} when a chart
 * query cannot be run. Dashboard rendering records it against the failing chart only.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ChartExecutionException extends RuntimeException {

    private final long chartId;

    public ChartExecutionException(long chartId, String message) {
        super(message);
        this.chartId = chartId;
    }

    public ChartExecutionException(long chartId, String message, Throwable cause) {
        super(message, cause);
        this.chartId = chartId;
    }

    public long getChartId() {
        return chartId;
    }
}
