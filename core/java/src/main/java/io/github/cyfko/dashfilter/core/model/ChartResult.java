package io.github.cyfko.dashfilter.core.model;

/**
 * Rendered state of one chart of a filtered dashboard.
 * <p>
 * A failed chart keeps whatever rewrite was computed (possibly {@code null}) and an error message;
 * siblings are unaffected.
 * </p>
 *
 * @param chartId the chart
 * @param rewrite the composed query, {@code null} if composition itself failed
 * @param data    the executed rows, {@code null} on failure
 * @param error   the failure message, {@code null} on success
 */
public record ChartResult(long chartId, RewriteResult rewrite, QueryResult data, String error) {

    public static ChartResult success(long chartId, RewriteResult rewrite, QueryResult data) {
        return new ChartResult(chartId, rewrite, data, null);
    }

    public static ChartResult failure(long chartId, RewriteResult rewrite, String error) {
        return new ChartResult(chartId, rewrite, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
