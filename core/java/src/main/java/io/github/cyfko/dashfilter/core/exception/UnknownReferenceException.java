package io.github.cyfko.dashfilter.core.exception;

/**
 * Base class for referential-integrity failures: the caller named an entity that does not exist.
 * Transport layers map every subclass to a "not found" answer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class UnknownReferenceException extends RuntimeException {

    private final Object reference;

    protected UnknownReferenceException(String message, Object reference) {
        super(message);
        this.reference = reference;
    }

    /**
     * @return the identifier or name that could not be resolved
     */
    public Object getReference() {
        return reference;
    }
}
