package io.github.cyfko.dashfilter.core.exception;

/**
 * Thrown when the chart registry has no query for a chart id.
 */
public class UnknownChartException extends UnknownReferenceException {

    public UnknownChartException(long chartId) {
        super("Chart with id=" + chartId + " not found", chartId);
    }
}
