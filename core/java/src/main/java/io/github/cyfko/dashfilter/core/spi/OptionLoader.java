package io.github.cyfko.dashfilter.core.spi;

import io.github.cyfko.dashfilter.core.model.OptionItem;

import java.util.List;

/**
 * Runs an option query built by {@link io.github.cyfko.dashfilter.core.option.OptionQueryBuilder}.
 * <p>
 * The query selects the option value first and, when the source has a label join, the label second.
 * A missing or {@code null} label falls back to the value's text.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface OptionLoader {

    List<OptionItem> load(String sql);
}
