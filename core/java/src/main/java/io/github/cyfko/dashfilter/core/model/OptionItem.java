package io.github.cyfko.dashfilter.core.model;

import java.util.Objects;

/**
 * One entry of a dropdown: the value sent back as filter value and the text shown to the viewer.
 *
 * @param value the filter value
 * @param label the display text, defaults to the value's string form
 */
public record OptionItem(Object value, String label) {

    public OptionItem {
        Objects.requireNonNull(value, "Option value cannot be null");
        if (label == null) {
            label = String.valueOf(value);
        }
    }

    public static OptionItem of(Object value) {
        return new OptionItem(value, null);
    }
}
