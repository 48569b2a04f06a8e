package io.github.cyfko.dashfilter.core.model;

import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

import java.util.List;

/**
 * Options listed explicitly in the selector configuration.
 *
 * @param items the options, in display order
 */
public record StaticValueSource(List<OptionItem> items) implements ValueSource {

    public StaticValueSource {
        if (items == null) {
            throw new SelectorDefinitionException("Static value source requires an item list");
        }
        items = List.copyOf(items);
    }
}
