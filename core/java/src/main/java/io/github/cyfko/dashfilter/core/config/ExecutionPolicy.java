package io.github.cyfko.dashfilter.core.config;

import java.time.Duration;

/**
 * Limits applied when composed chart queries are executed for a dashboard.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>chartTimeout</strong>: how long one chart may run before it is marked failed (default: 5 s)</li>
 *   <li><strong>maxRows</strong>: row cap enforced with a top-level {@code LIMIT} (default: 10 000)</li>
 *   <li><strong>parallelism</strong>: number of charts executed at the same time (default: 4)</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExecutionPolicy policy = ExecutionPolicy.defaults();
 *
 * ExecutionPolicy custom = ExecutionPolicy.builder()
 *     .chartTimeout(Duration.ofSeconds(30))
 *     .maxRows(500)
 *     .build();
 * }</pre>
 *
 * @param chartTimeout per-chart execution timeout, bounded by the dashboard refresh interval in practice
 * @param maxRows      maximum number of rows returned for one chart
 * @param parallelism  number of worker threads used to execute charts
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExecutionPolicy(
        Duration chartTimeout,
        int maxRows,
        int parallelism
) {

    public ExecutionPolicy {
        if (chartTimeout == null || chartTimeout.isZero() || chartTimeout.isNegative()) {
            throw new IllegalArgumentException("chartTimeout must be positive, got: " + chartTimeout);
        }
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, got: " + maxRows);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
    }

    /**
     * @return 5 second timeout, 10 000 rows, 4 parallel charts
     */
    public static ExecutionPolicy defaults() {
        return new ExecutionPolicy(Duration.ofSeconds(5), 10_000, 4);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration _chartTimeout = Duration.ofSeconds(5);
        private int _maxRows = 10_000;
        private int _parallelism = 4;

        private Builder() {}

        public ExecutionPolicy build() {
            return new ExecutionPolicy(_chartTimeout, _maxRows, _parallelism);
        }

        public Builder chartTimeout(Duration chartTimeout) { this._chartTimeout = chartTimeout; return this; }
        public Builder maxRows(int maxRows) { this._maxRows = maxRows; return this; }
        public Builder parallelism(int parallelism) { this._parallelism = parallelism; return this; }
    }
}
