package io.github.cyfko.dashfilter.core.model;

/**
 * Lower and upper bound of a {@code between} filter value, e.g. the two ends of a date range.
 *
 * @param from inclusive lower bound
 * @param to   inclusive upper bound
 */
public record ValueRange(Object from, Object to) {

    public static ValueRange of(Object from, Object to) {
        return new ValueRange(from, to);
    }
}
