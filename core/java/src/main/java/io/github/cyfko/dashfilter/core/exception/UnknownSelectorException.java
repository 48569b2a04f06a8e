package io.github.cyfko.dashfilter.core.exception;

/**
 * Thrown when a selector id does not resolve to a stored selector.
 */
public class UnknownSelectorException extends UnknownReferenceException {

    public UnknownSelectorException(long selectorId) {
        super("Selector with id=" + selectorId + " not found", selectorId);
    }
}
