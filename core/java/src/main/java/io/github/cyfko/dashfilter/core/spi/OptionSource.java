package io.github.cyfko.dashfilter.core.spi;

import io.github.cyfko.dashfilter.core.model.OptionItem;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Supplies the selectable options of dropdown and multi-select selectors.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface OptionSource {

    /**
     * Lists the options of one selector.
     *
     * @param selectorId selector identifier
     * @return options in display order, empty for selectors without a value source
     * @throws io.github.cyfko.dashfilter.core.exception.UnknownSelectorException if the selector does not exist
     */
    List<OptionItem> listOptions(long selectorId);

    /**
     * Lists the options of several selectors in one call.
     * <p>
     * The default implementation calls {@link #listOptions(long)} per selector; implementations backed by
     * a database should share work between selectors reading the same source.
     * </p>
     *
     * @param selectorIds selector identifiers
     * @return options per selector id, in the order of the given ids
     */
    default Map<Long, List<OptionItem>> listOptionsBatch(Collection<Long> selectorIds) {
        Map<Long, List<OptionItem>> result = new LinkedHashMap<>();
        for (Long id : selectorIds) {
            result.put(id, listOptions(id));
        }
        return result;
    }
}
