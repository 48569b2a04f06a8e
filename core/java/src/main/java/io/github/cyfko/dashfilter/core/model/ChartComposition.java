package io.github.cyfko.dashfilter.core.model;

/**
 * Composition outcome for one chart: either a rewrite or the error that prevented it.
 * Errors are kept per chart so one malformed query does not hide its siblings.
 *
 * @param chartId        the chart
 * @param result         the rewrite, {@code null} on failure
 * @param predicateCount number of predicates injected
 * @param error          the failure, {@code null} on success
 */
public record ChartComposition(long chartId, RewriteResult result, int predicateCount, RuntimeException error) {

    public static ChartComposition success(long chartId, RewriteResult result, int predicateCount) {
        return new ChartComposition(chartId, result, predicateCount, null);
    }

    public static ChartComposition failure(long chartId, RuntimeException error) {
        return new ChartComposition(chartId, null, 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
