package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.model.SelectorMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for selector-to-chart mappings.
 * <p>
 * Stores enforce the uniqueness of {@code (selectorId, chartId, targetColumn, targetTable)}. Lists are
 * returned in insertion order (ascending id), which is the order predicates are combined in.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface MappingStore {

    /**
     * Inserts a mapping without id or replaces the stored mapping with the same id.
     *
     * @param mapping mapping to save
     * @return the saved mapping, with its id
     * @throws io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException if the selector already
     *         maps the same chart column
     * @throws io.github.cyfko.dashfilter.core.exception.UnknownMappingException if the id is set but not stored
     */
    SelectorMapping save(SelectorMapping mapping);

    Optional<SelectorMapping> findById(long id);

    List<SelectorMapping> findBySelector(long selectorId);

    List<SelectorMapping> findByChart(long chartId);

    /**
     * Lists the mappings of several selectors, in insertion order across all of them.
     */
    default List<SelectorMapping> findBySelectors(Collection<Long> selectorIds) {
        List<SelectorMapping> mappings = new ArrayList<>();
        for (Long selectorId : selectorIds) {
            mappings.addAll(findBySelector(selectorId));
        }
        mappings.sort(Comparator.comparing(SelectorMapping::id));
        return mappings;
    }

    boolean deleteById(long id);

    /**
     * @param selectorId selector whose mappings are removed
     * @return the number of removed mappings
     */
    int deleteBySelector(long selectorId);
}
