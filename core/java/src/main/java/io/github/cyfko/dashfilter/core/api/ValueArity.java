package io.github.cyfko.dashfilter.core.api;

/**
 * Shape of the runtime value an {@link Operator} expects.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ValueArity {

    /** A single scalar: string, number, boolean or date. */
    SINGLE,

    /** A non-empty collection or array of scalars. */
    MULTIPLE,

    /** Exactly two scalars, a lower and an upper bound. */
    PAIR
}
