package io.github.cyfko.dashfilter.core.exception;

import java.util.List;

/**
 * Exception thrown when a dashboard is applied without a value for one of its required selectors.
 * <p>
 * The dashboard is not rendered at all: showing unfiltered data for a selector the author marked as
 * required would be misleading. The exception lists every missing selector, not only the first one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MissingRequiredFilterException extends RuntimeException {

    private final List<String> selectorNames;

    public MissingRequiredFilterException(List<String> selectorNames) {
        super("Required filters have no value: " + String.join(", ", selectorNames));
        this.selectorNames = List.copyOf(selectorNames);
    }

    /**
     * @return names of the required selectors without an active value, in selector order
     */
    public List<String> getSelectorNames() {
        return selectorNames;
    }
}
