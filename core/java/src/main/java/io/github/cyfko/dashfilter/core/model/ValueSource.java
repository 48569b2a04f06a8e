package io.github.cyfko.dashfilter.core.model;

/**
 * Where a list selector (dropdown, multi-select) takes its options from.
 * <p>
 * Either a fixed list of {@link OptionItem}s kept with the selector ({@link StaticValueSource}),
 * or the distinct values of a database column, optionally labelled through a lookup table
 * ({@link DatabaseValueSource}). Date and text selectors carry no value source.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ValueSource permits StaticValueSource, DatabaseValueSource {
}
