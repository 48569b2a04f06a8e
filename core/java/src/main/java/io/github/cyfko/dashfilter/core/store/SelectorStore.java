package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.model.Selector;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for selector definitions.
 * <p>
 * Stores persist and enforce the uniqueness of {@code (dashboardId, name)}; structural validation
 * lives in {@link Selector} itself and cross-entity rules in {@link SelectorManager}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SelectorStore {

    /**
     * Inserts a selector without id or replaces the stored selector with the same id.
     *
     * @param selector selector to save
     * @return the saved selector, with its id
     * @throws io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException if another selector of the
     *         dashboard already uses the name
     * @throws io.github.cyfko.dashfilter.core.exception.UnknownSelectorException if the id is set but not stored
     */
    Selector save(Selector selector);

    Optional<Selector> findById(long id);

    Optional<Selector> findByName(long dashboardId, String name);

    /**
     * @param dashboardId dashboard identifier
     * @return the dashboard's selectors ordered by {@code (sortOrder, id)}
     */
    List<Selector> findByDashboard(long dashboardId);

    /**
     * @param id selector identifier
     * @return {@code true} if a selector was removed
     */
    boolean deleteById(long id);
}
