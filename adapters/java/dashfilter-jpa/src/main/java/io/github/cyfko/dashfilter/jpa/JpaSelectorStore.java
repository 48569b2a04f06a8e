package io.github.cyfko.dashfilter.jpa;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.store.SelectorStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.List;
import java.util.Optional;

/**
 * {@link SelectorStore} backed by the {@code dashboard_selectors} table.
 * <p>
 * The persistence unit must list {@link SelectorEntity}. Each call opens its own entity manager
 * and transaction, so the store is safe to share between threads.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EntityManagerFactory emf = Persistence.createEntityManagerFactory("dashboards");
 * SelectorStore selectors = new JpaSelectorStore(emf);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaSelectorStore implements SelectorStore {

    private final JpaTransactions transactions;

    public JpaSelectorStore(EntityManagerFactory emf) {
        this.transactions = new JpaTransactions(emf);
    }

    @Override
    public Selector save(Selector selector) {
        return transactions.write(em -> {
            if (nameTaken(em, selector)) {
                throw new DuplicateDefinitionException(duplicateMessage(selector));
            }
            if (selector.id() == null) {
                SelectorEntity entity = SelectorEntity.from(selector);
                em.persist(entity);
                em.flush();
                return entity.toSelector();
            }
            SelectorEntity entity = em.find(SelectorEntity.class, selector.id());
            if (entity == null) {
                throw new UnknownSelectorException(selector.id());
            }
            entity.copy(selector);
            return entity.toSelector();
        }, () -> duplicateMessage(selector));
    }

    @Override
    public Optional<Selector> findById(long id) {
        return transactions.read(em -> Optional.ofNullable(em.find(SelectorEntity.class, id))
                .map(SelectorEntity::toSelector));
    }

    @Override
    public Optional<Selector> findByName(long dashboardId, String name) {
        return transactions.read(em -> em.createQuery(
                        "SELECT s FROM SelectorEntity s WHERE s.dashboardId = :dashboardId AND s.name = :name",
                        SelectorEntity.class)
                .setParameter("dashboardId", dashboardId)
                .setParameter("name", name)
                .getResultStream()
                .findFirst()
                .map(SelectorEntity::toSelector));
    }

    @Override
    public List<Selector> findByDashboard(long dashboardId) {
        return transactions.read(em -> em.createQuery(
                        "SELECT s FROM SelectorEntity s WHERE s.dashboardId = :dashboardId ORDER BY s.sortOrder, s.id",
                        SelectorEntity.class)
                .setParameter("dashboardId", dashboardId)
                .getResultList()
                .stream()
                .map(SelectorEntity::toSelector)
                .toList());
    }

    @Override
    public boolean deleteById(long id) {
        return transactions.write(em -> em.createQuery("DELETE FROM SelectorEntity s WHERE s.id = :id")
                .setParameter("id", id)
                .executeUpdate() > 0, () -> "Selector " + id + " is still referenced");
    }

    private static boolean nameTaken(EntityManager em, Selector selector) {
        return em.createQuery("SELECT s.id FROM SelectorEntity s WHERE s.dashboardId = :dashboardId AND s.name = :name",
                        Long.class)
                .setParameter("dashboardId", selector.dashboardId())
                .setParameter("name", selector.name())
                .getResultStream()
                .anyMatch(id -> !id.equals(selector.id()));
    }

    private static String duplicateMessage(Selector selector) {
        return "Selector '" + selector.name() + "' already exists on dashboard " + selector.dashboardId();
    }
}
