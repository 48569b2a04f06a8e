package io.github.cyfko.dashfilter.core.exception;

/**
 * Thrown when a mapping id does not resolve to a stored mapping.
 */
public class UnknownMappingException extends UnknownReferenceException {

    public UnknownMappingException(long mappingId) {
        super("Mapping with id=" + mappingId + " not found", mappingId);
    }
}
