package io.github.cyfko.dashfilter.core.exception;

/**
 * Exception thrown when a query is refused before execution: it is not read-only, holds more than
 * one statement or references a table outside the allowed set.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnsafeQueryException extends RuntimeException {

    public UnsafeQueryException(String message) {
        super(message);
    }
}
